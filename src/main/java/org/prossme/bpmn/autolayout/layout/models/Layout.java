package org.prossme.bpmn.autolayout.layout.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The geometry of one process graph. Maps keep node and flow declaration order so that every
 * walk over a layout is deterministic.
 *
 * @param nodeBounds    bounds of every node of this graph (nested bodies live in {@code subLayouts})
 * @param flowWaypoints ordered polyline of every sequence flow of this graph
 * @param laneBands     one band per declared lane, top to bottom
 * @param levels        column index assigned to each node
 * @param totalWidth    extent of the placed content measured from the layout origin
 * @param totalHeight   extent of the placed content measured from the layout origin
 * @param subLayouts    nested layouts keyed by the owning sub-process node id
 */
public record Layout(
        Map<String, Bounds> nodeBounds,
        Map<String, List<Point>> flowWaypoints,
        List<LaneBand> laneBands,
        Map<String, Integer> levels,
        double totalWidth,
        double totalHeight,
        Map<String, SubProcessLayout> subLayouts
) {
    public static final String SCOPE_SEPARATOR = "/";

    public Layout {
        nodeBounds = Collections.unmodifiableMap(new LinkedHashMap<>(nodeBounds));
        Map<String, List<Point>> waypointsCopy = new LinkedHashMap<>();
        flowWaypoints.forEach((flowId, points) -> waypointsCopy.put(flowId, List.copyOf(points)));
        flowWaypoints = Collections.unmodifiableMap(waypointsCopy);
        laneBands = List.copyOf(laneBands);
        levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
        subLayouts = Collections.unmodifiableMap(new LinkedHashMap<>(subLayouts));
    }

    public static Layout empty() {
        return new Layout(Map.of(), Map.of(), List.of(), Map.of(), 0, 0, Map.of());
    }

    /**
     * Returns a copy translated by (dx, dy). Expanded sub-process bodies move with their parent;
     * collapsed ones stay on their own plane.
     */
    public Layout offset(double dx, double dy) {
        Map<String, Bounds> movedBounds = new LinkedHashMap<>();
        nodeBounds.forEach((id, bounds) -> movedBounds.put(id, bounds.translate(dx, dy)));

        Map<String, List<Point>> movedWaypoints = new LinkedHashMap<>();
        flowWaypoints.forEach((id, points) -> {
            List<Point> moved = new ArrayList<>(points.size());
            points.forEach(point -> moved.add(point.translate(dx, dy)));
            movedWaypoints.put(id, moved);
        });

        List<LaneBand> movedBands = new ArrayList<>(laneBands.size());
        laneBands.forEach(band -> movedBands.add(band.translate(dx, dy)));

        Map<String, SubProcessLayout> movedSubLayouts = new LinkedHashMap<>();
        subLayouts.forEach((id, sub) -> movedSubLayouts.put(id, sub.expanded() ? sub.translate(dx, dy) : sub));

        return new Layout(movedBounds, movedWaypoints, movedBands, levels, totalWidth, totalHeight, movedSubLayouts);
    }

    /**
     * Bounds of every node in this graph and, recursively, in every sub-process body, with the
     * nesting offsets applied. Nested nodes are keyed by their scope path ({@code Sub/Task}),
     * since ids only need to be unique within their own graph.
     */
    public Map<String, Bounds> absoluteNodeBounds() {
        Map<String, Bounds> all = new LinkedHashMap<>();
        collectNodeBounds("", all);
        return all;
    }

    /**
     * Waypoints of every flow in this graph and, recursively, in every sub-process body, keyed
     * like {@link #absoluteNodeBounds()}.
     */
    public Map<String, List<Point>> absoluteFlowWaypoints() {
        Map<String, List<Point>> all = new LinkedHashMap<>();
        collectFlowWaypoints("", all);
        return all;
    }

    /**
     * Absolute bounds of a node looked up by plain id: this graph first, then sub-process
     * bodies in declaration order.
     */
    public Optional<Bounds> findAbsoluteBounds(String nodeId) {
        Bounds own = nodeBounds.get(nodeId);
        if (own != null) {
            return Optional.of(own);
        }
        for (SubProcessLayout sub : subLayouts.values()) {
            Optional<Bounds> nested = sub.positioned().findAbsoluteBounds(nodeId);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    public static String scopedId(String subProcessId, String nodeId) {
        return subProcessId + SCOPE_SEPARATOR + nodeId;
    }

    private void collectNodeBounds(String prefix, Map<String, Bounds> into) {
        nodeBounds.forEach((id, bounds) -> into.put(prefix + id, bounds));
        subLayouts.forEach((id, sub) -> sub.positioned().collectNodeBounds(prefix + id + SCOPE_SEPARATOR, into));
    }

    private void collectFlowWaypoints(String prefix, Map<String, List<Point>> into) {
        flowWaypoints.forEach((id, points) -> into.put(prefix + id, points));
        subLayouts.forEach((id, sub) -> sub.positioned().collectFlowWaypoints(prefix + id + SCOPE_SEPARATOR, into));
    }

    public Layout withLaneBands(List<LaneBand> bands) {
        return new Layout(nodeBounds, flowWaypoints, bands, levels, totalWidth, totalHeight, subLayouts);
    }

    public Bounds boundsOf(String nodeId) {
        Bounds bounds = nodeBounds.get(nodeId);
        if (bounds == null) {
            throw new IllegalStateException("Layout has no bounds for node '" + nodeId + "'");
        }
        return bounds;
    }
}
