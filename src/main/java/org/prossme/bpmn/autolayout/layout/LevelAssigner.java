package org.prossme.bpmn.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Longest-path leveling over the whole flow graph, ignoring lanes, so that nodes connected by a
 * flow land in consecutive columns whichever lane they belong to.
 * <p>
 * Edges closing a cycle (back edges of a depth-first walk from the roots) do not contribute,
 * which keeps the worklist finite on loops and rework paths.
 */
@Slf4j
public class LevelAssigner {

    private record Edge(String source, String target, int delta) {}

    public static LevelAssignment assignLevels(ProcessGraph graph) {
        List<FlowNode> nodes = graph.nodes();
        if (nodes.isEmpty()) {
            return new LevelAssignment(Map.of(), 0);
        }

        Map<String, FlowNode> nodesById = graph.nodesById();
        Map<String, List<Edge>> outgoing = new HashMap<>();
        Map<String, List<Edge>> incoming = new HashMap<>();

        for (SequenceFlow flow : graph.flows()) {
            if (nodesById.containsKey(flow.sourceRef()) && nodesById.containsKey(flow.targetRef())) {
                addEdge(new Edge(flow.sourceRef(), flow.targetRef(), 1), outgoing, incoming);
            }
        }
        // a boundary event shares the column of its host
        for (FlowNode node : nodes) {
            if (node.isAttachedBoundaryEvent() && nodesById.containsKey(node.attachedToRef())) {
                addEdge(new Edge(node.attachedToRef(), node.id(), 0), outgoing, incoming);
            }
        }

        List<String> roots = new ArrayList<>();
        for (FlowNode node : nodes) {
            if (!incoming.containsKey(node.id())) {
                roots.add(node.id());
            }
        }
        if (roots.isEmpty()) {
            roots.add(nodes.get(0).id());
        }

        Set<Edge> backEdges = findBackEdges(nodes, roots, outgoing);
        int maxLevel = nodes.size() - 1;

        Map<String, Integer> levels = new LinkedHashMap<>();
        Deque<String> worklist = new ArrayDeque<>();
        for (String root : roots) {
            levels.put(root, 0);
            worklist.add(root);
        }

        int steps = relax(worklist, levels, outgoing, backEdges, maxLevel);

        // nodes only reachable through a cycle: seed the first one in declaration order
        for (FlowNode node : nodes) {
            if (levels.containsKey(node.id())) {
                continue;
            }
            int seed = 0;
            for (Edge edge : incoming.getOrDefault(node.id(), List.of())) {
                Integer sourceLevel = levels.get(edge.source());
                if (sourceLevel != null) {
                    seed = Math.max(seed, Math.min(sourceLevel + edge.delta(), maxLevel));
                }
            }
            levels.put(node.id(), seed);
            worklist.add(node.id());
            steps += relax(worklist, levels, outgoing, backEdges, maxLevel);
        }

        // re-key in declaration order
        Map<String, Integer> ordered = new LinkedHashMap<>();
        nodes.forEach(node -> ordered.put(node.id(), levels.get(node.id())));

        log.debug("Leveled {} nodes of '{}' in {} steps ({} back edges ignored)",
                nodes.size(), graph.id(), steps, backEdges.size());
        return new LevelAssignment(ordered, steps);
    }

    private static int relax(Deque<String> worklist, Map<String, Integer> levels,
                             Map<String, List<Edge>> outgoing, Set<Edge> backEdges, int maxLevel) {
        int steps = 0;
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            int currentLevel = levels.get(current);

            for (Edge edge : outgoing.getOrDefault(current, List.of())) {
                steps++;
                if (backEdges.contains(edge)) {
                    continue;
                }
                int candidate = Math.min(currentLevel + edge.delta(), maxLevel);
                Integer targetLevel = levels.get(edge.target());
                if (targetLevel == null || targetLevel < candidate) {
                    levels.put(edge.target(), candidate);
                    worklist.add(edge.target());
                }
            }
        }
        return steps;
    }

    /**
     * Iterative depth-first walk from the roots (then from any node not reached yet, in
     * declaration order). An edge into a node still on the walk stack closes a cycle.
     */
    private static Set<Edge> findBackEdges(List<FlowNode> nodes, List<String> roots,
                                           Map<String, List<Edge>> outgoing) {
        Set<Edge> backEdges = new HashSet<>();
        Set<String> finished = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        List<String> starts = new ArrayList<>(roots);
        nodes.forEach(node -> starts.add(node.id()));

        for (String start : starts) {
            if (finished.contains(start) || onStack.contains(start)) {
                continue;
            }

            Deque<String> stack = new ArrayDeque<>();
            Deque<Integer> nextEdge = new ArrayDeque<>();
            stack.push(start);
            nextEdge.push(0);
            onStack.add(start);

            while (!stack.isEmpty()) {
                String current = stack.peek();
                int index = nextEdge.pop();
                List<Edge> edges = outgoing.getOrDefault(current, List.of());

                if (index >= edges.size()) {
                    stack.pop();
                    onStack.remove(current);
                    finished.add(current);
                    continue;
                }

                nextEdge.push(index + 1);
                Edge edge = edges.get(index);
                if (onStack.contains(edge.target())) {
                    backEdges.add(edge);
                } else if (!finished.contains(edge.target())) {
                    stack.push(edge.target());
                    nextEdge.push(0);
                    onStack.add(edge.target());
                }
            }
        }
        return backEdges;
    }

    private static void addEdge(Edge edge, Map<String, List<Edge>> outgoing, Map<String, List<Edge>> incoming) {
        outgoing.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.target(), key -> new ArrayList<>()).add(edge);
    }
}
