package org.prossme.bpmn.autolayout.bpmn;

import org.junit.jupiter.api.Test;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.Collaboration;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructureValidatorTest {
    private static final String DANGLING_BPMN = "src/test/resources/bpmn/dangling-flow.bpmn";
    private static final String SUBPROCESS_BPMN = "src/test/resources/bpmn/subprocess.bpmn";
    private static final String COLLABORATION_BPMN = "src/test/resources/bpmn/collaboration.bpmn";

    @Test
    void shouldAcceptValidDocuments() {
        assertDoesNotThrow(() -> StructureValidator.validate(BpmnHelper.parseBpmnFile(SUBPROCESS_BPMN)));
        assertDoesNotThrow(() -> StructureValidator.validate(BpmnHelper.parseBpmnFile(COLLABORATION_BPMN)));
    }

    @Test
    void shouldRejectDanglingFlowTarget() {
        BpmnData data = BpmnHelper.parseBpmnFile(DANGLING_BPMN);

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(data));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
        assertTrue(exception.getMessage().contains("Missing"));
    }

    @Test
    void shouldRejectDuplicateNodeIds() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", "first", NodeType.TASK), new FlowNode("A", "second", NodeType.TASK)),
                List.of(), List.of());

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(graph));
        assertEquals(StructuralException.Reason.DUPLICATE_ID, exception.getReason());
    }

    @Test
    void shouldRejectFlowIdCollidingWithNodeId() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", null, NodeType.START_EVENT), new FlowNode("B", null, NodeType.END_EVENT)),
                List.of(new SequenceFlow("A", "A", "B")), List.of());

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(graph));
        assertEquals(StructuralException.Reason.DUPLICATE_ID, exception.getReason());
    }

    @Test
    void shouldAllowSameIdInDifferentScopes() {
        ProcessGraph body = new ProcessGraph("Sub", null,
                List.of(new FlowNode("Task", null, NodeType.TASK)), List.of(), List.of());
        FlowNode sub = FlowNode.builder().id("Sub").type(NodeType.SUB_PROCESS).expanded(true).body(body).build();
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("Task", null, NodeType.TASK), sub), List.of(), List.of());

        assertDoesNotThrow(() -> StructureValidator.validate(graph));
    }

    @Test
    void shouldRejectIdReusedAcrossScopesOfOneDocument() {
        ProcessGraph body = new ProcessGraph("Sub", null,
                List.of(new FlowNode("Start", null, NodeType.START_EVENT)), List.of(), List.of());
        FlowNode sub = FlowNode.builder().id("Sub").type(NodeType.SUB_PROCESS).expanded(true).body(body).build();
        ProcessGraph process = new ProcessGraph("P", null,
                List.of(new FlowNode("Start", null, NodeType.START_EVENT), sub), List.of(), List.of());

        StructuralException exception = assertThrows(StructuralException.class,
                () -> StructureValidator.validate(new BpmnData("D", null, null, List.of(process))));
        assertEquals(StructuralException.Reason.DUPLICATE_ID, exception.getReason());
        assertTrue(exception.getMessage().contains("'Start'"));
    }

    @Test
    void shouldRejectIdSharedByTwoProcesses() {
        ProcessGraph first = new ProcessGraph("P1", null, List.of(new FlowNode("A", null, NodeType.TASK)),
                List.of(), List.of());
        ProcessGraph second = new ProcessGraph("P2", null, List.of(new FlowNode("A", null, NodeType.TASK)),
                List.of(), List.of());

        StructuralException exception = assertThrows(StructuralException.class,
                () -> StructureValidator.validate(new BpmnData("D", null, null, List.of(first, second))));
        assertEquals(StructuralException.Reason.DUPLICATE_ID, exception.getReason());
    }

    @Test
    void shouldRejectDanglingReferenceInsideSubProcess() {
        ProcessGraph body = new ProcessGraph("Sub", null,
                List.of(new FlowNode("Inner", null, NodeType.TASK)),
                List.of(new SequenceFlow("Inner_Flow", "Inner", "Outer")), List.of());
        FlowNode sub = FlowNode.builder().id("Sub").type(NodeType.SUB_PROCESS).expanded(true).body(body).build();
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("Outer", null, NodeType.TASK), sub), List.of(), List.of());

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(graph));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
    }

    @Test
    void shouldRejectUnknownLaneMember() {
        ProcessGraph graph = new ProcessGraph("P", null,
                List.of(new FlowNode("A", null, NodeType.TASK)), List.of(),
                List.of(new Lane("L", "Lane", List.of("A", "Ghost"))));

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(graph));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
    }

    @Test
    void shouldRejectBoundaryEventOnUnknownHost() {
        FlowNode boundary = FlowNode.builder().id("B").type(NodeType.BOUNDARY_EVENT).attachedToRef("Nope").build();
        ProcessGraph graph = new ProcessGraph("P", null, List.of(boundary), List.of(), List.of());

        StructuralException exception = assertThrows(StructuralException.class, () -> StructureValidator.validate(graph));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
    }

    @Test
    void shouldRejectUnknownParticipantProcess() {
        ProcessGraph process = new ProcessGraph("P", null, List.of(new FlowNode("A", null, NodeType.TASK)),
                List.of(), List.of());
        Collaboration collaboration = new Collaboration("C",
                List.of(new Participant("Pool", "Pool", "Other")), List.of());

        StructuralException exception = assertThrows(StructuralException.class,
                () -> StructureValidator.validate(new BpmnData("D", null, collaboration, List.of(process))));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
    }

    @Test
    void shouldRejectUnknownMessageFlowEndpoint() {
        ProcessGraph process = new ProcessGraph("P", null, List.of(new FlowNode("A", null, NodeType.TASK)),
                List.of(), List.of());
        Collaboration collaboration = new Collaboration("C",
                List.of(new Participant("Pool", "Pool", "P")),
                List.of(new MessageFlow("M", null, "A", "Elsewhere")));

        StructuralException exception = assertThrows(StructuralException.class,
                () -> StructureValidator.validate(new BpmnData("D", null, collaboration, List.of(process))));
        assertEquals(StructuralException.Reason.DANGLING_REFERENCE, exception.getReason());
    }

    @Test
    void shouldRejectDefinitionsWithoutProcess() {
        StructuralException exception = assertThrows(StructuralException.class,
                () -> StructureValidator.validate(new BpmnData("D", null, null, List.of())));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
    }

    @Test
    void shouldAllowCycles() {
        assertDoesNotThrow(() -> StructureValidator.validate(
                BpmnHelper.parseBpmnFile("src/test/resources/bpmn/cycle.bpmn")));
    }
}
