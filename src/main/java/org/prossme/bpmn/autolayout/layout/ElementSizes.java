package org.prossme.bpmn.autolayout.layout;

import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.config.LayoutConfig;
import org.prossme.bpmn.autolayout.layout.models.Bounds;

/**
 * Default shape footprints, matching what BPMN modelers draw.
 */
public final class ElementSizes {

    public static final double EVENT_SIZE = 36;
    public static final double GATEWAY_SIZE = 50;
    public static final double TASK_WIDTH = 100;
    public static final double TASK_HEIGHT = 80;

    private ElementSizes() {
    }

    /**
     * Footprint of a node at the origin. Sub-processes get the collapsed (task) size here; the
     * expanded size depends on the body and comes from {@link #expanded}.
     */
    public static Bounds footprint(FlowNode node) {
        return switch (node.category()) {
            case EVENT -> new Bounds(0, 0, EVENT_SIZE, EVENT_SIZE);
            case GATEWAY -> new Bounds(0, 0, GATEWAY_SIZE, GATEWAY_SIZE);
            case ACTIVITY, SUB_PROCESS -> new Bounds(0, 0, TASK_WIDTH, TASK_HEIGHT);
        };
    }

    /**
     * Footprint of an expanded sub-process whose body needs {@code bodyWidth x bodyHeight}.
     */
    public static Bounds expanded(double bodyWidth, double bodyHeight, LayoutConfig config) {
        double padding = config.subProcessPadding();
        return new Bounds(0, 0,
                Math.max(bodyWidth + 2 * padding, config.minSubProcessWidth()),
                Math.max(bodyHeight + 2 * padding, config.minSubProcessHeight()));
    }
}
