package org.prossme.bpmn.autolayout.routing;

import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;
import org.prossme.bpmn.autolayout.config.LayoutConfig;
import org.prossme.bpmn.autolayout.layout.models.Bounds;
import org.prossme.bpmn.autolayout.layout.models.LaneBand;
import org.prossme.bpmn.autolayout.layout.models.Point;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orthogonal-ish polylines for sequence and message flows. Sequence flows leave the source at its
 * right middle and enter the target at its left middle.
 */
public class EdgeRouter {

    /**
     * Routes every flow of one graph.
     *
     * @param nodeBounds bounds of every node the flows connect
     * @param laneOfNode the band each node sits in; empty when the graph has no lanes
     */
    public static Map<String, List<Point>> routeFlows(List<SequenceFlow> flows, Map<String, Bounds> nodeBounds,
                                                      Map<String, LaneBand> laneOfNode, LayoutConfig config) {
        Map<String, List<Point>> waypoints = new LinkedHashMap<>();
        for (SequenceFlow flow : flows) {
            Bounds source = nodeBounds.get(flow.sourceRef());
            Bounds target = nodeBounds.get(flow.targetRef());
            if (source == null || target == null) {
                throw new IllegalStateException("Flow '" + flow.id() + "' connects a node without bounds");
            }

            LaneBand sourceBand = laneOfNode.get(flow.sourceRef());
            LaneBand targetBand = laneOfNode.get(flow.targetRef());
            if (sourceBand != null && targetBand != null && !sourceBand.laneId().equals(targetBand.laneId())) {
                waypoints.put(flow.id(), routeAcrossLanes(source, sourceBand, target, targetBand, config));
            } else {
                waypoints.put(flow.id(), route(source, target));
            }
        }
        return waypoints;
    }

    /**
     * Same lane (or no lanes): a straight segment when the target starts right of the source,
     * otherwise a jog at the horizontal midpoint.
     */
    public static List<Point> route(Bounds source, Bounds target) {
        Point exit = new Point(source.right(), source.centerY());
        Point entry = new Point(target.x(), target.centerY());

        if (target.x() > source.right()) {
            return List.of(exit, entry);
        }

        double midX = (exit.x() + entry.x()) / 2;
        return List.of(exit, new Point(midX, exit.y()), new Point(midX, entry.y()), entry);
    }

    /**
     * Leaves the source lane sideways, runs along a row just outside the source band, then drops
     * into the target from its left. Backward flows keep closer to the nodes.
     */
    public static List<Point> routeAcrossLanes(Bounds source, LaneBand sourceBand,
                                               Bounds target, LaneBand targetBand, LayoutConfig config) {
        Point exit = new Point(source.right(), source.centerY());
        Point entry = new Point(target.x(), target.centerY());

        double jumpY;
        if (targetBand.y() >= sourceBand.bottom()) {
            jumpY = sourceBand.bottom() + config.laneJumpGap();
        } else if (targetBand.bottom() <= sourceBand.y()) {
            jumpY = sourceBand.y() - config.laneJumpGap();
        } else {
            jumpY = (exit.y() + entry.y()) / 2;
        }

        boolean forward = target.x() > source.right();
        double offset = forward ? config.crossLaneOffset() : config.backwardLaneOffset();
        double exitX = exit.x() + offset;
        double entryX = entry.x() - offset;

        return List.of(
                exit,
                new Point(exitX, exit.y()),
                new Point(exitX, jumpY),
                new Point(entryX, jumpY),
                new Point(entryX, entry.y()),
                entry);
    }

    /**
     * Message flows run vertically between pools: from the source edge facing the target to the
     * target edge facing the source, with the horizontal run halfway between.
     */
    public static List<Point> routeMessageFlow(Bounds source, Bounds target) {
        Point start;
        Point end;
        if (target.y() >= source.centerY()) {
            start = new Point(source.centerX(), source.bottom());
            end = new Point(target.centerX(), target.y());
        } else {
            start = new Point(source.centerX(), source.y());
            end = new Point(target.centerX(), target.bottom());
        }

        double midY = (start.y() + end.y()) / 2;
        return List.of(start, new Point(start.x(), midY), new Point(end.x(), midY), end);
    }
}
