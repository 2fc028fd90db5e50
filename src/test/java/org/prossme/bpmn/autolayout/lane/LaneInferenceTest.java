package org.prossme.bpmn.autolayout.lane;

import org.junit.jupiter.api.Test;
import org.prossme.bpmn.autolayout.bpmn.BpmnHelper;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaneInferenceTest {
    private static final String INFERRED_LANES_BPMN = "src/test/resources/bpmn/inferred-lanes.bpmn";
    private static final String LANE_SPLIT_BPMN = "src/test/resources/bpmn/lane-split.bpmn";

    private static Lane laneNamed(ProcessGraph graph, String name) {
        return graph.lanes().stream().filter(lane -> name.equals(lane.name())).findFirst().orElseThrow();
    }

    @Test
    void shouldAssignKycReviewToCompliance() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("Kyc", "KYC Review", NodeType.USER_TASK)),
                List.of(),
                List.of(new Lane("Lane_Customer", "Customer", List.of()),
                        new Lane("Lane_Compliance", "Compliance", List.of())));

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(List.of("Kyc"), laneNamed(resolved, "Compliance").flowNodeRefs());
        assertTrue(laneNamed(resolved, "Customer").flowNodeRefs().isEmpty());
    }

    @Test
    void shouldInferEveryNodeOfTheFixture() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(INFERRED_LANES_BPMN).processes().get(0);

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(List.of("Start", "Submit", "End", "Escalated"), laneNamed(resolved, "Customer").flowNodeRefs());
        assertEquals(List.of("Kyc", "KycTimeout"), laneNamed(resolved, "Compliance").flowNodeRefs());
        assertEquals(List.of("Open"), laneNamed(resolved, "Core System").flowNodeRefs());
    }

    @Test
    void shouldDefaultUnmatchedNodesToFirstLane() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("X", "Zzz", NodeType.TASK)),
                List.of(),
                List.of(new Lane("L1", "Alpha", List.of()), new Lane("L2", "Beta", List.of())));

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(List.of("X"), resolved.lanes().get(0).flowNodeRefs());
    }

    @Test
    void shouldBreakTiesTowardsEarlierLane() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("X", "Approve", NodeType.USER_TASK)),
                List.of(),
                List.of(new Lane("L1", "Buyers", List.of()), new Lane("L2", "Sellers", List.of())));

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(List.of("X"), resolved.lanes().get(0).flowNodeRefs());
    }

    @Test
    void shouldKeepDeclaredMembership() {
        ProcessGraph graph = BpmnHelper.parseBpmnFile(LANE_SPLIT_BPMN).processes().get(0);

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(graph.lanes(), resolved.lanes());
    }

    @Test
    void shouldPlaceUnlistedNodesInFirstLaneAndDropDuplicates() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", "A", NodeType.TASK),
                        new FlowNode("B", "B", NodeType.TASK),
                        new FlowNode("C", "C", NodeType.TASK)),
                List.of(),
                List.of(new Lane("L1", "One", List.of("A")),
                        new Lane("L2", "Two", List.of("B", "A"))));

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertEquals(List.of("A", "C"), resolved.lanes().get(0).flowNodeRefs());
        assertEquals(List.of("B"), resolved.lanes().get(1).flowNodeRefs());
    }

    @Test
    void shouldMoveBoundaryEventsToTheirHostLane() {
        FlowNode host = new FlowNode("Host", "Host", NodeType.USER_TASK);
        FlowNode timer = FlowNode.builder().id("Timer").type(NodeType.BOUNDARY_EVENT).attachedToRef("Host").build();
        ProcessGraph graph = new ProcessGraph("P", null, List.of(host, timer), List.of(),
                List.of(new Lane("L1", "One", List.of("Timer")), new Lane("L2", "Two", List.of("Host"))));

        ProcessGraph resolved = LaneInference.resolveLanes(graph);

        assertTrue(resolved.lanes().get(0).flowNodeRefs().isEmpty());
        assertEquals(List.of("Host", "Timer"), resolved.lanes().get(1).flowNodeRefs());
    }

    @Test
    void shouldReturnGraphWithoutLanesUnchanged() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", "A", NodeType.TASK)), List.of(), List.of());

        assertSame(graph, LaneInference.resolveLanes(graph));
    }

    @Test
    void shouldUseCustomRules() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", "Anything", NodeType.TASK)),
                List.of(),
                List.of(new Lane("L1", "One", List.of()), new Lane("L2", "Two", List.of())));
        LaneScoringRule preferTwo = (node, lane) -> "Two".equals(lane.name()) ? 1 : 0;

        ProcessGraph resolved = LaneInference.resolveLanes(graph, List.of(preferTwo));

        assertEquals(List.of("A"), resolved.lanes().get(1).flowNodeRefs());
    }
}
