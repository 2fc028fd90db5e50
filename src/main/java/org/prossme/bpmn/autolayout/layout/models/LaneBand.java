package org.prossme.bpmn.autolayout.layout.models;

/**
 * The horizontal band a lane occupies on the canvas.
 */
public record LaneBand(String laneId, String name, double x, double y, double width, double height) {

    public double bottom() {
        return y + height;
    }

    public boolean containsVertically(Bounds bounds) {
        return bounds.y() >= y && bounds.bottom() <= bottom();
    }

    public LaneBand translate(double dx, double dy) {
        return new LaneBand(laneId, name, x + dx, y + dy, width, height);
    }
}
