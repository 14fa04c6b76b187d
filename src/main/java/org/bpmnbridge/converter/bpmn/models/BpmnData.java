package org.bpmnbridge.converter.bpmn.models;

import java.util.List;

/**
 * Everything extracted from one input document: the definitions id, the
 * processes in document order and the diagram shapes found in the DI layer.
 */
public record BpmnData(
        String definitionsId,
        List<ProcessDef> processes,
        List<DiagramShape> shapes
) {
    public BpmnData {
        processes = processes == null ? List.of() : List.copyOf(processes);
        shapes = shapes == null ? List.of() : List.copyOf(shapes);
    }
}
