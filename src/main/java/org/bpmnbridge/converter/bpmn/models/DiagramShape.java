package org.bpmnbridge.converter.bpmn.models;

import lombok.Builder;

/**
 * A BPMNShape read from the input diagram layer.
 *
 * Example from BPMN:
 * <bpmndi:BPMNShape id="Activity_1ktuyru_di" bpmnElement="Activity_1ktuyru">
 *   <dc:Bounds x="270" y="80" width="100" height="80" />
 * </bpmndi:BPMNShape>
 *
 * Coordinates and sizes are null when the source did not declare them or they
 * could not be read as numbers.
 */
@Builder
public record DiagramShape(
        String bpmnElement,  // id of the annotated flow node
        String id,
        Integer x,
        Integer y,
        Integer width,
        Integer height
) {
}
