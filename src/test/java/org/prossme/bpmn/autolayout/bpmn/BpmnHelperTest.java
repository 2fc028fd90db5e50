package org.prossme.bpmn.autolayout.bpmn;

import org.junit.jupiter.api.Test;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnHelperTest {
    private static final String LINEAR_BPMN = "src/test/resources/bpmn/linear.bpmn";
    private static final String LANE_SPLIT_BPMN = "src/test/resources/bpmn/lane-split.bpmn";
    private static final String SUBPROCESS_BPMN = "src/test/resources/bpmn/subprocess.bpmn";
    private static final String COLLABORATION_BPMN = "src/test/resources/bpmn/collaboration.bpmn";

    @Test
    void shouldParseNodesAndFlowsInDeclarationOrder() {
        BpmnData data = BpmnHelper.parseBpmnFile(LINEAR_BPMN);

        assertEquals("Definitions_Linear", data.id());
        assertEquals(1, data.processes().size());

        ProcessGraph process = data.processes().get(0);
        assertEquals("Process_Linear", process.id());
        assertEquals(List.of("Start", "TaskA", "TaskB", "End"),
                process.nodes().stream().map(FlowNode::id).toList());
        assertEquals(NodeType.START_EVENT, process.nodes().get(0).type());
        assertEquals(NodeType.TASK, process.nodes().get(1).type());
        assertEquals(3, process.flows().size());
        assertFalse(process.hasLanes());
    }

    @Test
    void shouldParseLaneMembership() {
        ProcessGraph process = BpmnHelper.parseBpmnFile(LANE_SPLIT_BPMN).processes().get(0);

        assertEquals(2, process.lanes().size());
        assertEquals("Customer", process.lanes().get(0).name());
        assertEquals(List.of("Start", "Approve", "End"), process.lanes().get(0).flowNodeRefs());
        assertEquals(List.of("Process"), process.lanes().get(1).flowNodeRefs());
    }

    @Test
    void shouldParseSubProcessBodyWithoutLeakingIntoParent() {
        ProcessGraph process = BpmnHelper.parseBpmnFile(SUBPROCESS_BPMN).processes().get(0);

        FlowNode fulfil = process.findNode("Fulfil").orElseThrow();
        assertTrue(fulfil.isSubProcess());
        assertTrue(fulfil.expanded());
        assertEquals(4, fulfil.body().nodes().size());
        assertEquals(3, fulfil.body().flows().size());

        assertTrue(process.findNode("Pick").isEmpty());
        assertTrue(process.flows().stream().noneMatch(flow -> flow.id().startsWith("Fulfil_")));
    }

    @Test
    void shouldParseBoundaryEventAndConditions() {
        ProcessGraph process = BpmnHelper.parseBpmnFile(SUBPROCESS_BPMN).processes().get(0);

        FlowNode cancelled = process.findNode("Cancelled").orElseThrow();
        assertTrue(cancelled.isAttachedBoundaryEvent());
        assertEquals("Fulfil", cancelled.attachedToRef());

        SequenceFlow yes = process.flows().stream()
                .filter(flow -> flow.id().equals("Flow_3"))
                .findFirst()
                .orElseThrow();
        assertEquals("yes", yes.name());
        assertEquals("${paid}", yes.conditionExpression());
    }

    @Test
    void shouldParseCollaboration() {
        BpmnData data = BpmnHelper.parseBpmnFile(COLLABORATION_BPMN);

        assertNotNull(data.collaboration());
        assertEquals("Collaboration_Purchase", data.collaboration().id());
        assertEquals(2, data.collaboration().participants().size());
        assertEquals("Process_Seller", data.collaboration().participants().get(1).processRef());
        assertEquals(2, data.collaboration().messageFlows().size());
        assertEquals(2, data.processes().size());
    }

    @Test
    void shouldIgnoreUnknownElements() {
        String xml = """
                <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="D">
                  <bpmn:process id="P">
                    <bpmn:dataObject id="Data"/>
                    <bpmn:textAnnotation id="Note"><bpmn:text>hello</bpmn:text></bpmn:textAnnotation>
                    <bpmn:task id="T"/>
                  </bpmn:process>
                </bpmn:definitions>
                """;

        ProcessGraph process = BpmnHelper.parseBpmn(xml).processes().get(0);

        assertEquals(1, process.nodes().size());
        assertEquals("T", process.nodes().get(0).id());
    }

    @Test
    void shouldRejectMalformedXml() {
        StructuralException exception = assertThrows(StructuralException.class,
                () -> BpmnHelper.parseBpmn("<bpmn:definitions><bpmn:process>"));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
    }

    @Test
    void shouldRejectDoctypeWithExternalEntity() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE definitions [<!ENTITY secret SYSTEM "file:///etc/passwd">]>
                <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="D">
                  <bpmn:process id="P"><bpmn:task id="T" name="&secret;"/></bpmn:process>
                </bpmn:definitions>
                """;

        StructuralException exception = assertThrows(StructuralException.class, () -> BpmnHelper.parseBpmn(xml));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
    }

    @Test
    void shouldRejectNonDefinitionsRoot() {
        StructuralException exception = assertThrows(StructuralException.class,
                () -> BpmnHelper.parseBpmn("<process id=\"P\"/>"));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
    }

    @Test
    void shouldFailWhenFileIsMissing() {
        assertThrows(RuntimeException.class, () -> BpmnHelper.parseBpmnFile("src/test/resources/bpmn/missing.bpmn"));
    }
}
