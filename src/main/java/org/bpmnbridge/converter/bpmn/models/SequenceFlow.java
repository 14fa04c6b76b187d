package org.bpmnbridge.converter.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two nodes of a process.
 *
 * @param id         the identifier of the sequence flow (synthesized when the source had none)
 * @param name       the name/label of the sequence flow, empty when absent
 * @param sourceRef  id of the node the flow leaves
 * @param targetRef  id of the node the flow enters
 * @param expression the raw condition expression text, or null for unconditional flows
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef,
        String expression
) {
    public SequenceFlow {
        name = name == null ? "" : name;
        sourceRef = sourceRef == null ? "" : sourceRef;
        targetRef = targetRef == null ? "" : targetRef;
    }

    // Constructor for unconditional flows
    public SequenceFlow(String id, String name, String sourceRef, String targetRef) {
        this(id, name, sourceRef, targetRef, null);
    }

    public boolean hasCondition() {
        return expression != null && !expression.isEmpty();
    }
}
