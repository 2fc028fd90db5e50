package org.prossme.bpmn.autolayout.lane;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves which lane every top-level node belongs to. Generated structure often declares lanes
 * without listing their members; those are inferred by scoring node names against lane names.
 * Declared membership is kept, only completed and de-duplicated.
 */
@Slf4j
public class LaneInference {

    public static ProcessGraph resolveLanes(ProcessGraph graph) {
        return resolveLanes(graph, LaneScoringRules.defaults());
    }

    /**
     * @return the graph with every node listed in exactly one lane, or the graph unchanged when it
     * declares no lanes
     */
    public static ProcessGraph resolveLanes(ProcessGraph graph, List<LaneScoringRule> rules) {
        if (!graph.hasLanes()) {
            return graph;
        }

        boolean noMembers = graph.lanes().stream().allMatch(lane -> lane.flowNodeRefs().isEmpty());
        Map<String, String> laneOfNode = noMembers
                ? infer(graph, rules)
                : normalize(graph);

        attachBoundaryEvents(graph, laneOfNode);
        return graph.withLanes(toLanes(graph.lanes(), graph.nodes(), laneOfNode));
    }

    /**
     * Scores every non-boundary node against every lane and picks the best lane. Ties go to the
     * earlier lane; a node that scores nothing anywhere goes to the first lane.
     */
    static Map<String, String> infer(ProcessGraph graph, List<LaneScoringRule> rules) {
        log.info("Lanes of '{}' declare no members, inferring membership for {} nodes",
                graph.id(), graph.nodes().size());

        Lane firstLane = graph.lanes().get(0);
        Map<String, String> laneOfNode = new LinkedHashMap<>();

        for (FlowNode node : graph.nodes()) {
            if (node.isAttachedBoundaryEvent()) {
                continue;
            }

            Lane bestLane = firstLane;
            int bestScore = 0;
            for (Lane lane : graph.lanes()) {
                int score = LaneScoringRules.score(rules, node, lane);
                if (score > bestScore) {
                    bestScore = score;
                    bestLane = lane;
                }
            }

            laneOfNode.put(node.id(), bestLane.id());
            if (bestScore > 0) {
                log.debug("Lane assignment: {} -> {} (score: {})", node.id(), bestLane.name(), bestScore);
            } else {
                log.debug("Lane assignment: {} -> {} (default)", node.id(), bestLane.name());
            }
        }
        return laneOfNode;
    }

    private static Map<String, String> normalize(ProcessGraph graph) {
        Map<String, FlowNode> nodesById = graph.nodesById();
        Map<String, String> laneOfNode = new LinkedHashMap<>();

        for (Lane lane : graph.lanes()) {
            for (String nodeId : lane.flowNodeRefs()) {
                String previous = laneOfNode.putIfAbsent(nodeId, lane.id());
                if (previous != null && !previous.equals(lane.id())) {
                    log.warn("Node '{}' is listed in lanes '{}' and '{}', keeping '{}'",
                            nodeId, previous, lane.id(), previous);
                }
            }
        }

        String firstLaneId = graph.lanes().get(0).id();
        for (FlowNode node : nodesById.values()) {
            if (!laneOfNode.containsKey(node.id()) && !node.isAttachedBoundaryEvent()) {
                log.warn("Node '{}' is not listed in any lane, placing it in '{}'", node.id(), firstLaneId);
                laneOfNode.put(node.id(), firstLaneId);
            }
        }
        return laneOfNode;
    }

    private static void attachBoundaryEvents(ProcessGraph graph, Map<String, String> laneOfNode) {
        String firstLaneId = graph.lanes().get(0).id();
        for (FlowNode node : graph.nodes()) {
            if (node.isAttachedBoundaryEvent()) {
                laneOfNode.put(node.id(), laneOfNode.getOrDefault(node.attachedToRef(), firstLaneId));
            }
        }
    }

    // rebuilds the member lists in node declaration order
    private static List<Lane> toLanes(List<Lane> lanes, List<FlowNode> nodes, Map<String, String> laneOfNode) {
        Map<String, List<String>> members = new LinkedHashMap<>();
        lanes.forEach(lane -> members.put(lane.id(), new ArrayList<>()));
        for (FlowNode node : nodes) {
            String laneId = laneOfNode.get(node.id());
            if (laneId != null) {
                members.get(laneId).add(node.id());
            }
        }

        List<Lane> resolved = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            resolved.add(lane.withFlowNodeRefs(members.get(lane.id())));
        }
        return resolved;
    }
}
