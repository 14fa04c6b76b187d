package org.bpmnbridge.converter.bpmn;

import org.bpmnbridge.converter.bpmn.models.BpmnData;
import org.bpmnbridge.converter.bpmn.models.DiagramLayout;
import org.bpmnbridge.converter.bpmn.models.DiagramShape;
import org.bpmnbridge.converter.bpmn.models.FlowNode;
import org.bpmnbridge.converter.bpmn.models.ProcessDef;
import org.bpmnbridge.converter.bpmn.models.ShapeBounds;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Merges the diagram shapes onto the flow nodes they annotate: fills in default
 * sizes and shifts every coordinate so nothing is drawn left of or above the
 * canvas margin.
 */
public class BpmnLayoutHelper {

    public static final int CANVAS_MARGIN = 100;

    /**
     * Default width and height of a flow node type.
     */
    public record Size(int width, int height) {
    }

    public static final Size DEFAULT_SIZE = new Size(100, 80);

    public static final Map<String, Size> DEFAULT_SIZES;

    static {
        Map<String, Size> sizes = new HashMap<>();
        Size event = new Size(36, 36);
        Size gateway = new Size(50, 50);
        for (String type : List.of("startEvent", "endEvent", "intermediateCatchEvent",
                "intermediateThrowEvent", "boundaryEvent")) {
            sizes.put(type, event);
        }
        for (String type : List.of("exclusiveGateway", "parallelGateway", "inclusiveGateway",
                "eventBasedGateway", "complexGateway")) {
            sizes.put(type, gateway);
        }
        sizes.put("userTask", DEFAULT_SIZE);
        sizes.put("task", DEFAULT_SIZE);
        DEFAULT_SIZES = Map.copyOf(sizes);
    }

    public static Size defaultSize(String type) {
        return DEFAULT_SIZES.getOrDefault(type, DEFAULT_SIZE);
    }

    /**
     * Builds the render records of all flow nodes.
     *
     * @param bpmnData the extracted document
     * @return render records keyed by node id plus the applied offset
     */
    public static DiagramLayout reconcileLayout(BpmnData bpmnData) {
        List<DiagramShape> shapes = bpmnData.shapes();
        int offsetX = computeOffset(shapes, DiagramShape::x);
        int offsetY = computeOffset(shapes, DiagramShape::y);

        // Seed a record per node, the first process claiming an id keeps it
        Map<String, ShapeBounds> boundsById = new LinkedHashMap<>();
        for (ProcessDef process : bpmnData.processes()) {
            for (FlowNode node : process.nodes()) {
                boundsById.putIfAbsent(node.id(), ShapeBounds.unplaced(node.type(), node.isGateway()));
            }
        }

        for (DiagramShape shape : shapes) {
            ShapeBounds bounds = boundsById.get(shape.bpmnElement());
            if (bounds == null) {
                continue; // shape of something we did not extract
            }
            Size size = defaultSize(bounds.type());
            boundsById.put(shape.bpmnElement(), bounds.place(
                    shape.bpmnElement() + "_di",
                    valueOrZero(shape.x()) + offsetX,
                    valueOrZero(shape.y()) + offsetY,
                    positiveOr(shape.width(), size.width()),
                    positiveOr(shape.height(), size.height())));
        }

        return new DiagramLayout(boundsById, offsetX, offsetY);
    }

    /**
     * Offset along one axis. Zero when no shape declares a coordinate on it,
     * otherwise enough to bring the smallest rendered coordinate up to the margin.
     * <p>
     * The minimum is taken over rendered coordinates, not only declared ones: a
     * shape without a coordinate is rendered at 0 and so counts as 0. Taking the
     * minimum of declared coordinates alone would let such a shape end up left of
     * (or above) the margin.
     */
    static int computeOffset(List<DiagramShape> shapes, Function<DiagramShape, Integer> axis) {
        boolean anyKnown = shapes.stream().map(axis).anyMatch(Objects::nonNull);
        if (!anyKnown) {
            return 0;
        }
        int min = shapes.stream()
                .map(axis)
                .mapToInt(BpmnLayoutHelper::valueOrZero)
                .min()
                .orElse(0);
        return Math.max(0, CANVAS_MARGIN - min);
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
