package org.bpmnbridge.converter.bpmn.models;

import java.util.List;

public record ProcessDef(
        String id,
        String name,
        List<FlowNode> nodes,   // StartEvent, Tasks, Gateways, EndEvent... in extraction order
        List<SequenceFlow> flows
) {
    public ProcessDef {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    /**
     * Finds a flow node of this process by its id.
     *
     * @param nodeId the flow node id
     * @return the flow node, or null if this process has none with that id
     */
    public FlowNode findNode(String nodeId) {
        return nodes.stream()
                .filter(node -> node.id().equals(nodeId))
                .findFirst()
                .orElse(null);
    }
}
