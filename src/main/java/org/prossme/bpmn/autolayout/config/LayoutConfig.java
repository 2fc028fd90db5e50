package org.prossme.bpmn.autolayout.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Spacing constants and minimum sizes shared read-only by every layout run.
 * Defaults live in {@code autolayout/layout-config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutConfig(
        double startX,
        double startY,
        double horizontalSpacing,
        double verticalSpacing,
        double rowHeight,            // slot height a stacked node is centered in
        double laneTopMargin,        // reserved for the lane label
        double laneBottomMargin,
        double minLaneHeight,
        double laneHeaderWidth,
        double laneRightPadding,
        double subProcessPadding,
        double minSubProcessWidth,
        double minSubProcessHeight,
        double boundarySpacing,
        double crossLaneOffset,
        double backwardLaneOffset,
        double laneJumpGap,
        double poolHeaderWidth,
        double poolSpacing
) {
    /**
     * The same constants with the canvas origin moved, used for sub-process bodies that are
     * laid out locally before being offset into their parent.
     */
    public LayoutConfig withOrigin(double x, double y) {
        return new LayoutConfig(x, y, horizontalSpacing, verticalSpacing, rowHeight, laneTopMargin,
                laneBottomMargin, minLaneHeight, laneHeaderWidth, laneRightPadding, subProcessPadding,
                minSubProcessWidth, minSubProcessHeight, boundarySpacing, crossLaneOffset,
                backwardLaneOffset, laneJumpGap, poolHeaderWidth, poolSpacing);
    }
}
