package org.prossme.bpmn.autolayout.bpmn;

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
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class BpmnHelper {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";

    // Sub-process flavours that are laid out exactly like a plain subProcess
    private static final Map<String, NodeType> ELEMENT_ALIASES = Map.of(
            "transaction", NodeType.SUB_PROCESS,
            "adHocSubProcess", NodeType.SUB_PROCESS
    );

    /**
     * Parses a BPMN file and returns its structure.
     *
     * @param bpmnFilePath the path to the BPMN file
     * @return BpmnData containing the parsed BPMN structure
     * @throws StructuralException if the markup does not decode into the process model
     */
    public static BpmnData parseBpmnFile(String bpmnFilePath) {
        String xml;
        try {
            xml = Files.readString(Paths.get(bpmnFilePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read BPMN file: " + bpmnFilePath, e);
        }
        return parseBpmn(xml);
    }

    /**
     * Parses structure-only BPMN XML. Any diagram interchange already present is ignored.
     *
     * @param xml the BPMN 2.0 markup
     * @return BpmnData containing the parsed BPMN structure
     * @throws StructuralException if the markup does not decode into the process model
     */
    public static BpmnData parseBpmn(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE, "BPMN markup is empty");
        }

        Document doc = parseDocument(xml);

        // Get root definitions element
        Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(definitionsEl.getLocalName())) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "Root element is not 'definitions' but '" + definitionsEl.getNodeName() + "'");
        }

        String id = attributeOrNull(definitionsEl, "id");
        String targetNamespace = attributeOrNull(definitionsEl, "targetNamespace");

        Collaboration collaboration = null;
        List<ProcessGraph> processes = new ArrayList<>();
        for (Element child : bpmnChildren(definitionsEl)) {
            switch (child.getLocalName()) {
                case "collaboration" -> collaboration = parseCollaboration(child);
                case "process" -> processes.add(parseContainer(child, true));
                default -> {
                    // messages, signals, errors and diagrams carry no structure to lay out
                }
            }
        }

        log.debug("Parsed definitions '{}' with {} process(es)", id, processes.size());
        return new BpmnData(id, targetNamespace, collaboration, processes);
    }

    /**
     * Parses the markup into a namespace-aware DOM document. DOCTYPE declarations and external
     * entities are refused.
     *
     * @throws StructuralException if the markup is not well-formed XML or declares a DOCTYPE
     */
    public static Document parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "Failed to decode BPMN markup: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new RuntimeException("Failed to create XML parser", e);
        }
    }

    private static Collaboration parseCollaboration(Element collaborationEl) {
        List<Participant> participants = new ArrayList<>();
        List<MessageFlow> messageFlows = new ArrayList<>();

        for (Element child : bpmnChildren(collaborationEl)) {
            if ("participant".equals(child.getLocalName())) {
                participants.add(new Participant(
                        attributeOrNull(child, "id"),
                        attributeOrNull(child, "name"),
                        attributeOrNull(child, "processRef")));
            } else if ("messageFlow".equals(child.getLocalName())) {
                messageFlows.add(new MessageFlow(
                        attributeOrNull(child, "id"),
                        attributeOrNull(child, "name"),
                        attributeOrNull(child, "sourceRef"),
                        attributeOrNull(child, "targetRef")));
            }
        }

        return new Collaboration(attributeOrNull(collaborationEl, "id"), participants, messageFlows);
    }

    /**
     * Parses a process or sub-process element. Only direct children are read so that nested
     * bodies stay with the sub-process that owns them.
     */
    private static ProcessGraph parseContainer(Element containerEl, boolean withLanes) {
        String id = attributeOrNull(containerEl, "id");
        String name = attributeOrNull(containerEl, "name");

        List<FlowNode> nodes = new ArrayList<>();
        List<SequenceFlow> flows = new ArrayList<>();
        List<Lane> lanes = new ArrayList<>();

        for (Element child : bpmnChildren(containerEl)) {
            String localName = child.getLocalName();

            if ("sequenceFlow".equals(localName)) {
                flows.add(parseSequenceFlow(child));
                continue;
            }
            if ("laneSet".equals(localName)) {
                if (withLanes && lanes.isEmpty()) {
                    lanes.addAll(parseLaneSet(child));
                }
                continue;
            }

            NodeType type = NodeType.fromElementName(localName).orElse(ELEMENT_ALIASES.get(localName));
            if (type != null) {
                nodes.add(parseFlowNode(child, type));
            }
        }

        return new ProcessGraph(id, name, nodes, flows, lanes);
    }

    private static FlowNode parseFlowNode(Element nodeEl, NodeType type) {
        FlowNode.FlowNodeBuilder builder = FlowNode.builder()
                .id(attributeOrNull(nodeEl, "id"))
                .name(attributeOrNull(nodeEl, "name"))
                .type(type);

        if (type == NodeType.BOUNDARY_EVENT) {
            builder.attachedToRef(attributeOrNull(nodeEl, "attachedToRef"));
        }

        if (type == NodeType.SUB_PROCESS) {
            ProcessGraph body = parseContainer(nodeEl, false);
            builder.body(body)
                    .expanded(!body.nodes().isEmpty())
                    .triggeredByEvent("true".equalsIgnoreCase(nodeEl.getAttribute("triggeredByEvent")));
        }

        return builder.build();
    }

    /**
     * Parses all lanes of a laneSet element. Nested child lane sets are not descended into.
     */
    private static List<Lane> parseLaneSet(Element laneSetEl) {
        List<Lane> lanes = new ArrayList<>();
        for (Element laneEl : bpmnChildren(laneSetEl)) {
            if (!"lane".equals(laneEl.getLocalName())) {
                continue;
            }

            // Parse all flowNodeRef elements
            List<String> flowNodeRefs = new ArrayList<>();
            for (Element refEl : bpmnChildren(laneEl)) {
                if ("flowNodeRef".equals(refEl.getLocalName())) {
                    String refText = refEl.getTextContent();
                    if (refText != null && !refText.trim().isEmpty()) {
                        flowNodeRefs.add(refText.trim());
                    }
                }
            }

            lanes.add(new Lane(attributeOrNull(laneEl, "id"), attributeOrNull(laneEl, "name"), flowNodeRefs));
        }
        return lanes;
    }

    private static SequenceFlow parseSequenceFlow(Element flowEl) {
        // Extract condition expression if present
        String expression = null;
        NodeList conditionNodes = flowEl.getElementsByTagNameNS(BPMN_NS, "conditionExpression");
        if (conditionNodes.getLength() > 0) {
            String text = conditionNodes.item(0).getTextContent();
            expression = text == null || text.isBlank() ? null : text.trim();
        }

        return new SequenceFlow(
                attributeOrNull(flowEl, "id"),
                attributeOrNull(flowEl, "name"),
                attributeOrNull(flowEl, "sourceRef"),
                attributeOrNull(flowEl, "targetRef"),
                expression);
    }

    /**
     * Direct child elements in the BPMN model namespace. Elements without a namespace are
     * accepted too, generated markup sometimes omits the declaration.
     */
    private static List<Element> bpmnChildren(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList childNodes = parent.getChildNodes();
        for (int i = 0; i < childNodes.getLength(); i++) {
            Node node = childNodes.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE || node.getLocalName() == null) {
                continue;
            }
            String namespace = node.getNamespaceURI();
            if (namespace == null || BPMN_NS.equals(namespace)) {
                children.add((Element) node);
            }
        }
        return children;
    }

    private static String attributeOrNull(Element element, String attributeName) {
        String value = element.getAttribute(attributeName);
        return value == null || value.isEmpty() ? null : value;
    }
}
