package org.prossme.bpmn.autolayout.layout.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pools stacked on one canvas.
 *
 * @param participantBounds pool shape per participant, in declaration order
 * @param processLayouts    layout of the process behind each participant, keyed by participant id;
 *                          black-box pools have none
 */
public record CollaborationLayout(
        String collaborationId,
        Map<String, Bounds> participantBounds,
        Map<String, Layout> processLayouts,
        Map<String, List<Point>> messageFlowWaypoints,
        double totalWidth,
        double totalHeight
) {
    public CollaborationLayout {
        participantBounds = Collections.unmodifiableMap(new LinkedHashMap<>(participantBounds));
        processLayouts = Collections.unmodifiableMap(new LinkedHashMap<>(processLayouts));
        Map<String, List<Point>> waypointsCopy = new LinkedHashMap<>();
        messageFlowWaypoints.forEach((flowId, points) -> waypointsCopy.put(flowId, List.copyOf(points)));
        messageFlowWaypoints = Collections.unmodifiableMap(waypointsCopy);
    }
}
