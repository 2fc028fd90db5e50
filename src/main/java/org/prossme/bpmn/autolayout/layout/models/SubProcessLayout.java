package org.prossme.bpmn.autolayout.layout.models;

/**
 * The layout of a sub-process body in its own local coordinates, plus the translation that
 * places it on the canvas. Expanded bodies sit inside the sub-process shape; collapsed bodies are
 * drawn on a separate drill-down plane.
 */
public record SubProcessLayout(Layout layout, double offsetX, double offsetY, boolean expanded) {

    public Layout positioned() {
        return layout.offset(offsetX, offsetY);
    }

    public SubProcessLayout translate(double dx, double dy) {
        return new SubProcessLayout(layout, offsetX + dx, offsetY + dy, expanded);
    }
}
