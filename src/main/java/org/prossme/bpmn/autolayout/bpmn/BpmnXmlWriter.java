package org.prossme.bpmn.autolayout.bpmn;

import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;

/**
 * Writes structural BPMN 2.0 markup for definitions that did not arrive as XML, so the diagram
 * interchange has a document to be merged into.
 */
public class BpmnXmlWriter {
    private static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String DEFAULT_TARGET_NAMESPACE = "http://bpmn.io/schema/bpmn";

    public static String write(BpmnData data) {
        return toXml(toDocument(data));
    }

    public static Document toDocument(BpmnData data) {
        Document doc = newDocument();

        Element definitions = doc.createElementNS(BpmnHelper.BPMN_NS, "bpmn:definitions");
        definitions.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:bpmn", BpmnHelper.BPMN_NS);
        definitions.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:xsi", XSI_NS);
        definitions.setAttribute("id", data.id());
        definitions.setAttribute("targetNamespace",
                data.targetNamespace() != null ? data.targetNamespace() : DEFAULT_TARGET_NAMESPACE);
        doc.appendChild(definitions);

        if (data.collaboration() != null) {
            Element collaboration = bpmnElement(doc, "collaboration", data.collaboration().id(), null);
            for (Participant participant : data.collaboration().participants()) {
                Element participantEl = bpmnElement(doc, "participant", participant.id(), participant.name());
                setIfPresent(participantEl, "processRef", participant.processRef());
                collaboration.appendChild(participantEl);
            }
            for (MessageFlow messageFlow : data.collaboration().messageFlows()) {
                Element messageFlowEl = bpmnElement(doc, "messageFlow", messageFlow.id(), messageFlow.name());
                messageFlowEl.setAttribute("sourceRef", messageFlow.sourceRef());
                messageFlowEl.setAttribute("targetRef", messageFlow.targetRef());
                collaboration.appendChild(messageFlowEl);
            }
            definitions.appendChild(collaboration);
        }

        for (ProcessGraph process : data.processes()) {
            Element processEl = bpmnElement(doc, "process", process.id(), process.name());
            processEl.setAttribute("isExecutable", "false");
            appendGraph(doc, processEl, process);
            definitions.appendChild(processEl);
        }

        return doc;
    }

    private static void appendGraph(Document doc, Element container, ProcessGraph graph) {
        if (graph.hasLanes()) {
            Element laneSet = bpmnElement(doc, "laneSet", "LaneSet_" + graph.id(), null);
            for (Lane lane : graph.lanes()) {
                Element laneEl = bpmnElement(doc, "lane", lane.id(), lane.name());
                for (String ref : lane.flowNodeRefs()) {
                    Element refEl = doc.createElementNS(BpmnHelper.BPMN_NS, "bpmn:flowNodeRef");
                    refEl.setTextContent(ref);
                    laneEl.appendChild(refEl);
                }
                laneSet.appendChild(laneEl);
            }
            container.appendChild(laneSet);
        }

        for (FlowNode node : graph.nodes()) {
            Element nodeEl = bpmnElement(doc, node.type().elementName(), node.id(), node.name());
            if (node.type() == NodeType.BOUNDARY_EVENT) {
                setIfPresent(nodeEl, "attachedToRef", node.attachedToRef());
            }
            if (node.isSubProcess()) {
                if (node.triggeredByEvent()) {
                    nodeEl.setAttribute("triggeredByEvent", "true");
                }
                if (node.body() != null) {
                    appendGraph(doc, nodeEl, node.body());
                }
            }
            container.appendChild(nodeEl);
        }

        for (SequenceFlow flow : graph.flows()) {
            Element flowEl = bpmnElement(doc, "sequenceFlow", flow.id(), flow.name());
            flowEl.setAttribute("sourceRef", flow.sourceRef());
            flowEl.setAttribute("targetRef", flow.targetRef());
            if (flow.conditionExpression() != null) {
                Element condition = doc.createElementNS(BpmnHelper.BPMN_NS, "bpmn:conditionExpression");
                condition.setAttributeNS(XSI_NS, "xsi:type", "bpmn:tFormalExpression");
                condition.setTextContent(flow.conditionExpression());
                flowEl.appendChild(condition);
            }
            container.appendChild(flowEl);
        }
    }

    private static Element bpmnElement(Document doc, String localName, String id, String name) {
        Element element = doc.createElementNS(BpmnHelper.BPMN_NS, "bpmn:" + localName);
        setIfPresent(element, "id", id);
        setIfPresent(element, "name", name);
        return element;
    }

    private static void setIfPresent(Element element, String attribute, String value) {
        if (value != null) {
            element.setAttribute(attribute, value);
        }
    }

    private static String toXml(Document doc) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));
            return stringWriter.toString();
        } catch (TransformerException e) {
            throw new RuntimeException("Failed to write BPMN structure", e);
        }
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new RuntimeException("Failed to create XML document builder", e);
        }
    }
}
