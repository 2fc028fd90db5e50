package org.prossme.bpmn.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.config.LayoutConfig;
import org.prossme.bpmn.autolayout.lane.LaneInference;
import org.prossme.bpmn.autolayout.layout.models.Bounds;
import org.prossme.bpmn.autolayout.layout.models.CollaborationLayout;
import org.prossme.bpmn.autolayout.layout.models.LaneBand;
import org.prossme.bpmn.autolayout.layout.models.Layout;
import org.prossme.bpmn.autolayout.layout.models.Point;
import org.prossme.bpmn.autolayout.layout.models.SubProcessLayout;
import org.prossme.bpmn.autolayout.routing.EdgeRouter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns levels and lane membership into bounds. Columns come from the global levels, rows from
 * declaration order within a column; lanes are horizontal bands stacked top to bottom.
 */
@Slf4j
public class GeometryLayout {

    /**
     * Lays out a process: resolves lane membership, levels the flow graph, places every node
     * (recursively through sub-processes) and routes every flow.
     */
    public static Layout layout(ProcessGraph graph, LayoutConfig config) {
        Layout layout = layoutGraph(graph, config, new Point(config.startX(), config.startY()));
        log.info("Laid out process '{}': {} nodes, {} flows, {} lanes, canvas {}x{}",
                graph.id(), graph.nodes().size(), graph.flows().size(), graph.lanes().size(),
                Math.round(layout.totalWidth()), Math.round(layout.totalHeight()));
        return layout;
    }

    /**
     * @param planeOrigin where collapsed sub-process bodies are drawn on their own plane
     */
    private static Layout layoutGraph(ProcessGraph input, LayoutConfig config, Point planeOrigin) {
        if (input.nodes().isEmpty() && !input.hasLanes()) {
            return Layout.empty();
        }

        ProcessGraph graph = LaneInference.resolveLanes(input);
        LevelAssignment levels = LevelAssigner.assignLevels(graph);

        // sizes first, expanded sub-processes need their body laid out to know theirs
        Map<String, Layout> bodies = new HashMap<>();
        Map<String, Bounds> sizes = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            Bounds size = ElementSizes.footprint(node);
            if (node.hasBody()) {
                Layout body = layoutGraph(node.body(), config.withOrigin(0, 0), planeOrigin);
                bodies.put(node.id(), body);
                if (node.expanded()) {
                    size = ElementSizes.expanded(body.totalWidth(), body.totalHeight(), config);
                }
            } else if (node.isSubProcess() && node.expanded()) {
                size = ElementSizes.expanded(0, 0, config);
            }
            sizes.put(node.id(), size);
        }

        double[] columnX = columnPositions(graph, levels, sizes, config);
        double[] columnWidth = columnWidths(graph, levels, sizes);

        Map<String, List<FlowNode>> boundaryEventsByHost = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            if (node.isAttachedBoundaryEvent()) {
                boundaryEventsByHost.computeIfAbsent(node.attachedToRef(), key -> new ArrayList<>()).add(node);
            }
        }

        Map<String, Bounds> nodeBounds = new LinkedHashMap<>();
        Map<String, LaneBand> laneOfNode = new HashMap<>();
        List<LaneBand> bands = new ArrayList<>();

        if (graph.hasLanes()) {
            double bandY = config.startY();
            double bandX = config.startX() - config.laneHeaderWidth();
            for (Lane lane : graph.lanes()) {
                List<FlowNode> members = new ArrayList<>();
                lane.flowNodeRefs().forEach(id -> graph.findNode(id).ifPresent(members::add));

                double contentBottom = placeStack(members, bandY + config.laneTopMargin(), levels, sizes,
                        columnX, columnWidth, boundaryEventsByHost, config, nodeBounds);
                double height = members.isEmpty()
                        ? config.minLaneHeight()
                        : Math.max(config.minLaneHeight(), contentBottom - bandY + config.laneBottomMargin());

                // width is fixed once every band is placed
                LaneBand band = new LaneBand(lane.id(), lane.name(), bandX, bandY, 0, height);
                bands.add(band);
                members.forEach(member -> laneOfNode.put(member.id(), band));
                bandY += height;
            }
        } else {
            placeStack(graph.nodes(), config.startY(), levels, sizes, columnX, columnWidth,
                    boundaryEventsByHost, config, nodeBounds);
        }

        double maxRight = config.startX();
        double maxBottom = config.startY();
        for (Bounds bounds : nodeBounds.values()) {
            maxRight = Math.max(maxRight, bounds.right());
            maxBottom = Math.max(maxBottom, bounds.bottom());
        }

        if (!bands.isEmpty()) {
            double bandRight = maxRight + config.laneRightPadding();
            List<LaneBand> sized = new ArrayList<>(bands.size());
            Map<String, LaneBand> sizedById = new HashMap<>();
            for (LaneBand band : bands) {
                LaneBand withWidth = new LaneBand(band.laneId(), band.name(), band.x(), band.y(),
                        bandRight - band.x(), band.height());
                sized.add(withWidth);
                sizedById.put(band.laneId(), withWidth);
            }
            bands = sized;
            laneOfNode.replaceAll((nodeId, band) -> sizedById.get(band.laneId()));
            maxRight = bandRight;
            maxBottom = Math.max(maxBottom, bands.get(bands.size() - 1).bottom());
        }

        Map<String, SubProcessLayout> subLayouts = new LinkedHashMap<>();
        for (FlowNode node : graph.nodes()) {
            Layout body = bodies.get(node.id());
            if (body == null) {
                continue;
            }
            if (node.expanded()) {
                Bounds host = nodeBounds.get(node.id());
                subLayouts.put(node.id(), new SubProcessLayout(body,
                        host.x() + config.subProcessPadding(), host.y() + config.subProcessPadding(), true));
            } else {
                subLayouts.put(node.id(), new SubProcessLayout(body, planeOrigin.x(), planeOrigin.y(), false));
            }
        }

        Map<String, List<Point>> waypoints = EdgeRouter.routeFlows(graph.flows(), nodeBounds, laneOfNode, config);

        return new Layout(nodeBounds, waypoints, bands, levels.levels(),
                maxRight - config.startX(), maxBottom - config.startY(), subLayouts);
    }

    /**
     * Stacks the given nodes column by column starting at {@code top}, each in a slot of height
     * {@code max(rowHeight, node height)}, and hangs boundary events on their hosts.
     *
     * @return the lowest edge of anything placed, or {@code top} when nothing was
     */
    private static double placeStack(List<FlowNode> nodes, double top, LevelAssignment levels,
                                     Map<String, Bounds> sizes, double[] columnX, double[] columnWidth,
                                     Map<String, List<FlowNode>> boundaryEventsByHost, LayoutConfig config,
                                     Map<String, Bounds> nodeBounds) {
        Map<Integer, Double> cursorByLevel = new HashMap<>();
        double bottom = top;

        for (FlowNode node : nodes) {
            if (node.isAttachedBoundaryEvent()) {
                continue;
            }
            int level = levels.levelOf(node.id());
            Bounds size = sizes.get(node.id());

            double slotTop = cursorByLevel.getOrDefault(level, top);
            double slotHeight = Math.max(config.rowHeight(), size.height());
            double x = columnX[level] + (columnWidth[level] - size.width()) / 2;
            double y = slotTop + (slotHeight - size.height()) / 2;

            Bounds bounds = new Bounds(x, y, size.width(), size.height());
            nodeBounds.put(node.id(), bounds);
            cursorByLevel.put(level, slotTop + slotHeight + config.verticalSpacing());
            bottom = Math.max(bottom, slotTop + slotHeight);

            List<FlowNode> attached = boundaryEventsByHost.getOrDefault(node.id(), List.of());
            for (int i = 0; i < attached.size(); i++) {
                Bounds event = placeBoundaryEvent(bounds, i, attached.size(), config);
                nodeBounds.put(attached.get(i).id(), event);
                bottom = Math.max(bottom, event.bottom());
            }
        }
        return bottom;
    }

    /**
     * Boundary events sit centered on the host's bottom edge; several on one host are spread
     * {@code boundarySpacing} apart around its center.
     */
    static Bounds placeBoundaryEvent(Bounds host, int index, int count, LayoutConfig config) {
        double size = ElementSizes.EVENT_SIZE;
        double centerX = host.centerX() + (index - (count - 1) / 2.0) * config.boundarySpacing();
        return new Bounds(centerX - size / 2, host.bottom() - size / 2, size, size);
    }

    private static double[] columnWidths(ProcessGraph graph, LevelAssignment levels, Map<String, Bounds> sizes) {
        double[] widths = new double[Math.max(levels.maxLevel() + 1, 1)];
        boolean[] occupied = new boolean[widths.length];
        for (FlowNode node : graph.nodes()) {
            if (node.isAttachedBoundaryEvent()) {
                continue;
            }
            int level = levels.levelOf(node.id());
            widths[level] = Math.max(widths[level], sizes.get(node.id()).width());
            occupied[level] = true;
        }
        for (int level = 0; level < widths.length; level++) {
            if (!occupied[level]) {
                widths[level] = ElementSizes.TASK_WIDTH;
            }
        }
        return widths;
    }

    private static double[] columnPositions(ProcessGraph graph, LevelAssignment levels,
                                            Map<String, Bounds> sizes, LayoutConfig config) {
        double[] widths = columnWidths(graph, levels, sizes);
        double[] positions = new double[widths.length];
        double x = config.startX();
        for (int level = 0; level < widths.length; level++) {
            positions[level] = x;
            x += widths[level] + config.horizontalSpacing();
        }
        return positions;
    }

    /**
     * Lays out every participant's process as a pool, pools stacked top to bottom and all as wide
     * as the widest one, then routes the message flows between them.
     */
    public static CollaborationLayout layoutCollaboration(BpmnData data, LayoutConfig config) {
        if (data.collaboration() == null) {
            throw new IllegalArgumentException("Definitions '" + data.id() + "' declare no collaboration");
        }

        double poolX = config.startX() - config.laneHeaderWidth() - config.poolHeaderWidth();
        double poolY = config.startY();

        Map<String, Layout> processLayouts = new LinkedHashMap<>();
        Map<String, Double> poolHeights = new LinkedHashMap<>();
        Map<String, Double> poolTops = new LinkedHashMap<>();
        double poolRight = config.startX() + config.laneRightPadding();

        for (Participant participant : data.collaboration().participants()) {
            ProcessGraph process = participant.processRef() == null
                    ? null
                    : data.findProcess(participant.processRef()).orElse(null);

            double height;
            if (process == null) {
                height = config.minLaneHeight();
            } else {
                double contentTop = process.hasLanes() ? poolY : poolY + config.laneTopMargin();
                LayoutConfig poolConfig = config.withOrigin(config.startX(), contentTop);
                Layout processLayout = layoutGraph(process, poolConfig, new Point(config.startX(), config.startY()));
                processLayouts.put(participant.id(), processLayout);

                height = process.hasLanes()
                        ? processLayout.totalHeight()
                        : Math.max(config.minLaneHeight(),
                        config.laneTopMargin() + processLayout.totalHeight() + config.laneBottomMargin());
                double contentRight = config.startX() + processLayout.totalWidth()
                        + (process.hasLanes() ? 0 : config.laneRightPadding());
                poolRight = Math.max(poolRight, contentRight);
            }

            poolTops.put(participant.id(), poolY);
            poolHeights.put(participant.id(), height);
            poolY += height + config.poolSpacing();
        }

        Map<String, Bounds> participantBounds = new LinkedHashMap<>();
        for (Participant participant : data.collaboration().participants()) {
            participantBounds.put(participant.id(), new Bounds(poolX, poolTops.get(participant.id()),
                    poolRight - poolX, poolHeights.get(participant.id())));
        }

        // lanes stretch to the shared pool edge
        double finalPoolRight = poolRight;
        processLayouts.replaceAll((participantId, processLayout) -> stretchLanes(processLayout, finalPoolRight));

        Map<String, List<Point>> messageWaypoints = new LinkedHashMap<>();
        for (MessageFlow messageFlow : data.collaboration().messageFlows()) {
            Bounds source = resolveEndpoint(messageFlow.sourceRef(), participantBounds, processLayouts);
            Bounds target = resolveEndpoint(messageFlow.targetRef(), participantBounds, processLayouts);
            if (source == null || target == null) {
                throw new IllegalStateException("Message flow '" + messageFlow.id() + "' connects an element without bounds");
            }
            messageWaypoints.put(messageFlow.id(), EdgeRouter.routeMessageFlow(source, target));
        }

        double totalHeight = participantBounds.isEmpty() ? 0 : poolY - config.poolSpacing() - config.startY();
        log.info("Laid out collaboration '{}': {} pools, {} message flows, canvas {}x{}",
                data.collaboration().id(), participantBounds.size(), messageWaypoints.size(),
                Math.round(poolRight - poolX), Math.round(totalHeight));

        return new CollaborationLayout(data.collaboration().id(), participantBounds, processLayouts,
                messageWaypoints, poolRight - poolX, totalHeight);
    }

    /**
     * A message flow endpoint is a pool or a node of any participant's process, nested bodies
     * included.
     */
    private static Bounds resolveEndpoint(String ref, Map<String, Bounds> participantBounds,
                                          Map<String, Layout> processLayouts) {
        Bounds pool = participantBounds.get(ref);
        if (pool != null) {
            return pool;
        }
        for (Layout processLayout : processLayouts.values()) {
            Optional<Bounds> node = processLayout.findAbsoluteBounds(ref);
            if (node.isPresent()) {
                return node.get();
            }
        }
        return null;
    }

    private static Layout stretchLanes(Layout layout, double right) {
        List<LaneBand> bands = new ArrayList<>(layout.laneBands().size());
        for (LaneBand band : layout.laneBands()) {
            bands.add(new LaneBand(band.laneId(), band.name(), band.x(), band.y(), right - band.x(), band.height()));
        }
        return layout.withLaneBands(bands);
    }
}
