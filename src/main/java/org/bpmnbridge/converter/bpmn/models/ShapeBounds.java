package org.bpmnbridge.converter.bpmn.models;

/**
 * Render record of one flow node: its canonical type plus the geometry it is
 * drawn with. Geometry fields stay null until a diagram shape is merged in.
 */
public record ShapeBounds(
        String diagramId,
        String type,
        boolean gateway,
        Integer x,
        Integer y,
        Integer width,
        Integer height
) {
    public static ShapeBounds unplaced(String type, boolean gateway) {
        return new ShapeBounds(null, type, gateway, null, null, null, null);
    }

    public ShapeBounds place(String diagramId, int x, int y, int width, int height) {
        return new ShapeBounds(diagramId, type, gateway, x, y, width, height);
    }

    public boolean hasGeometry() {
        return x != null;
    }

    public int rightX() {
        return x + width;
    }

    public int middleY() {
        return y + height / 2;
    }
}
