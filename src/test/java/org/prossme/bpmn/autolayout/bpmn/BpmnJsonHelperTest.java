package org.prossme.bpmn.autolayout.bpmn;

import org.junit.jupiter.api.Test;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;

import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class BpmnJsonHelperTest {
    private static final String LANE_SPLIT_JSON = "src/test/resources/json/lane-split.json";
    private static final String UNKNOWN_TYPE_JSON = "src/test/resources/json/unknown-type.json";

    @Test
    void shouldParseBareProcess() throws Exception {
        BpmnData data = BpmnJsonHelper.parseJson(Files.readString(Paths.get(LANE_SPLIT_JSON)));

        assertEquals("Definitions_Process_Json", data.id());
        assertNull(data.collaboration());

        ProcessGraph process = data.processes().get(0);
        assertEquals("Process_Json", process.id());
        assertEquals(5, process.nodes().size());
        assertEquals(4, process.flows().size());
        assertEquals(2, process.lanes().size());
        assertTrue(process.lanes().get(0).flowNodeRefs().isEmpty());
        assertEquals("${ok}", process.flows().get(3).conditionExpression());
    }

    @Test
    void shouldParseSubprocessSpelledInLowerCase() throws Exception {
        ProcessGraph process = BpmnJsonHelper.parseJson(Files.readString(Paths.get(LANE_SPLIT_JSON)))
                .processes().get(0);

        FlowNode review = process.findNode("Review").orElseThrow();
        assertEquals(NodeType.SUB_PROCESS, review.type());
        assertTrue(review.expanded());
        assertEquals(3, review.body().nodes().size());
        assertEquals(2, review.body().flows().size());
    }

    @Test
    void shouldParseDefinitionsWithCollaboration() {
        String json = """
                {
                  "id": "Definitions_1",
                  "collaboration": {
                    "participants": [{"id": "Pool_A", "name": "A", "processRef": "P_A"}],
                    "messageFlows": []
                  },
                  "processes": [{"id": "P_A", "elements": [{"id": "S", "type": "startEvent"}]}]
                }
                """;

        BpmnData data = BpmnJsonHelper.parseJson(json);

        assertEquals("Definitions_1", data.id());
        assertEquals("Collaboration_1", data.collaboration().id());
        assertEquals("P_A", data.collaboration().participants().get(0).processRef());
    }

    @Test
    void shouldRejectUnsupportedElementType() throws Exception {
        String json = Files.readString(Paths.get(UNKNOWN_TYPE_JSON));

        StructuralException exception = assertThrows(StructuralException.class, () -> BpmnJsonHelper.parseJson(json));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
        assertTrue(exception.getMessage().contains("dataStore"));
    }

    @Test
    void shouldRejectSchemaViolations() {
        String json = "{\"processes\": [{\"id\": \"P\", \"elements\": [{\"id\": \"S\"}]}]}";

        StructuralException exception = assertThrows(StructuralException.class, () -> BpmnJsonHelper.parseJson(json));
        assertEquals(StructuralException.Reason.UNDECODABLE, exception.getReason());
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(StructuralException.class, () -> BpmnJsonHelper.parseJson("{\"processes\": ["));
    }
}
