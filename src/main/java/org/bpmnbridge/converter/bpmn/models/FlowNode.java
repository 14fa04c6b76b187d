package org.bpmnbridge.converter.bpmn.models;

import lombok.Builder;

import java.util.List;

@Builder
public record FlowNode(
        String id,
        String type,  // canonical type, e.g. "userTask", "startEvent", "exclusiveGateway"
        String name,
        List<String> incoming, // sequence flow ids, document order, duplicates kept
        List<String> outgoing
) {
    public FlowNode {
        if (name == null) {
            name = "";
        }
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    }

    // Constructor for nodes declared without inner markers (self-closing tags)
    public FlowNode(String id, String type, String name) {
        this(id, type, name, List.of(), List.of());
    }

    public boolean isGateway() {
        return type != null && type.contains("Gateway");
    }
}
