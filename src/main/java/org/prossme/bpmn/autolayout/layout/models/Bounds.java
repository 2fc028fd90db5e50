package org.prossme.bpmn.autolayout.layout.models;

/**
 * Real-valued rectangle; rounding to integers happens only when diagram markup is written.
 */
public record Bounds(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }

    public Bounds withSize(double newWidth, double newHeight) {
        return new Bounds(x, y, newWidth, newHeight);
    }
}
