package org.prossme.bpmn.autolayout.bpmn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.Collaboration;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the JSON flavour of the structural document:
 * <pre>
 * {"id": "...", "processes": [{"id": "...", "elements": [...], "flows": [...], "lanes": [...]}]}
 * </pre>
 * A bare process object (with "elements" at the root) is accepted as a single-process document.
 */
@Slf4j
public class BpmnJsonHelper {

    private static final String SCHEMA_RESOURCE = "autolayout/process-structure.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema schema = loadSchema();

    /**
     * Parses and validates a JSON structural document.
     *
     * @param json the JSON text
     * @return the parsed definitions
     * @throws StructuralException if the JSON is malformed or does not match the structure schema
     */
    public static BpmnData parseJson(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "Failed to decode JSON structure: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "JSON structure must be an object");
        }

        ObjectNode definitions = wrapBareProcess((ObjectNode) root);

        Set<ValidationMessage> errors = schema.validate(definitions);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "JSON structure does not match the schema: " + details);
        }

        List<ProcessGraph> processes = new ArrayList<>();
        for (JsonNode processNode : definitions.get("processes")) {
            processes.add(parseGraph(processNode, true));
        }

        String id = text(definitions, "id");
        return new BpmnData(
                id != null ? id : "Definitions_" + processes.get(0).id(),
                text(definitions, "targetNamespace"),
                parseCollaboration(definitions.get("collaboration")),
                processes);
    }

    private static ObjectNode wrapBareProcess(ObjectNode root) {
        if (root.has("processes") || !root.has("elements")) {
            return root;
        }
        ObjectNode definitions = mapper.createObjectNode();
        ArrayNode processes = definitions.putArray("processes");
        processes.add(root);
        return definitions;
    }

    private static ProcessGraph parseGraph(JsonNode graphNode, boolean withLanes) {
        List<FlowNode> nodes = new ArrayList<>();
        for (JsonNode elementNode : array(graphNode, "elements")) {
            nodes.add(parseElement(elementNode));
        }

        List<SequenceFlow> flows = new ArrayList<>();
        for (JsonNode flowNode : array(graphNode, "flows")) {
            flows.add(new SequenceFlow(
                    text(flowNode, "id"),
                    text(flowNode, "name"),
                    text(flowNode, "sourceRef"),
                    text(flowNode, "targetRef"),
                    text(flowNode, "conditionExpression")));
        }

        List<Lane> lanes = new ArrayList<>();
        if (withLanes) {
            for (JsonNode laneNode : array(graphNode, "lanes")) {
                List<String> refs = new ArrayList<>();
                array(laneNode, "flowNodeRefs").forEach(ref -> refs.add(ref.asText()));
                lanes.add(new Lane(text(laneNode, "id"), text(laneNode, "name"), refs));
            }
        }

        return new ProcessGraph(text(graphNode, "id"), text(graphNode, "name"), nodes, flows, lanes);
    }

    private static FlowNode parseElement(JsonNode elementNode) {
        String typeName = text(elementNode, "type");
        NodeType type = NodeType.fromElementName(typeName)
                .orElseThrow(() -> new StructuralException(StructuralException.Reason.UNDECODABLE,
                        String.format("Element '%s' has unsupported type '%s'", text(elementNode, "id"), typeName)));

        FlowNode.FlowNodeBuilder builder = FlowNode.builder()
                .id(text(elementNode, "id"))
                .name(text(elementNode, "name"))
                .type(type)
                .attachedToRef(text(elementNode, "attachedToRef"))
                .triggeredByEvent(elementNode.path("triggeredByEvent").asBoolean(false));

        if (type == NodeType.SUB_PROCESS) {
            ProcessGraph body = parseGraph(elementNode, false);
            // the sub-process carries its own id and name, the body shares them
            builder.body(body)
                    .expanded(elementNode.path("expanded").asBoolean(!body.nodes().isEmpty()));
        }

        return builder.build();
    }

    private static Collaboration parseCollaboration(JsonNode collaborationNode) {
        if (collaborationNode == null || collaborationNode.isNull()) {
            return null;
        }

        List<Participant> participants = new ArrayList<>();
        for (JsonNode participantNode : array(collaborationNode, "participants")) {
            participants.add(new Participant(
                    text(participantNode, "id"),
                    text(participantNode, "name"),
                    text(participantNode, "processRef")));
        }

        List<MessageFlow> messageFlows = new ArrayList<>();
        for (JsonNode flowNode : array(collaborationNode, "messageFlows")) {
            messageFlows.add(new MessageFlow(
                    text(flowNode, "id"),
                    text(flowNode, "name"),
                    text(flowNode, "sourceRef"),
                    text(flowNode, "targetRef")));
        }

        String id = text(collaborationNode, "id");
        return new Collaboration(id != null ? id : "Collaboration_1", participants, messageFlows);
    }

    private static Iterable<JsonNode> array(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node != null && node.isArray() ? node : List.of();
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static JsonSchema loadSchema() {
        try (InputStream schemaStream = BpmnJsonHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema: " + SCHEMA_RESOURCE, e);
        }
    }
}
