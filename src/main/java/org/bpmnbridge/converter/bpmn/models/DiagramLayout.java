package org.bpmnbridge.converter.bpmn.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Render records keyed by flow node id, in the order the nodes were first seen,
 * together with the offset that was applied to every coordinate.
 */
public record DiagramLayout(
        Map<String, ShapeBounds> boundsById,
        int offsetX,
        int offsetY
) {
    public DiagramLayout {
        boundsById = Collections.unmodifiableMap(new LinkedHashMap<>(boundsById));
    }

    public boolean isGateway(String nodeId) {
        ShapeBounds bounds = boundsById.get(nodeId);
        return bounds != null && bounds.gateway();
    }

    /**
     * @return the render record of the node if it has geometry, null otherwise
     */
    public ShapeBounds placedBounds(String nodeId) {
        ShapeBounds bounds = boundsById.get(nodeId);
        return bounds != null && bounds.hasGeometry() ? bounds : null;
    }
}
