package org.prossme.bpmn.autolayout.bpmn.models;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A process (or sub-process body): ordered nodes, sequence flows and lanes. Sub-process nodes
 * own their body graph by value, so a graph and its descendants form a tree.
 */
public record ProcessGraph(
        String id,
        String name,
        List<FlowNode> nodes,    // declaration order is significant for layout
        List<SequenceFlow> flows,
        List<Lane> lanes
) {
    public ProcessGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        flows = flows == null ? List.of() : List.copyOf(flows);
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
    }

    public Map<String, FlowNode> nodesById() {
        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }
        return byId;
    }

    public Optional<FlowNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> node.id().equals(nodeId)).findFirst();
    }

    public boolean hasLanes() {
        return !lanes.isEmpty();
    }

    public ProcessGraph withLanes(List<Lane> newLanes) {
        return new ProcessGraph(id, name, nodes, flows, newLanes);
    }

    public ProcessGraph withNodes(List<FlowNode> newNodes) {
        return new ProcessGraph(id, name, newNodes, flows, lanes);
    }
}
