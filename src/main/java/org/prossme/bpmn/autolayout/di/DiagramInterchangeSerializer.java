package org.prossme.bpmn.autolayout.di;

import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;
import org.prossme.bpmn.autolayout.layout.models.Bounds;
import org.prossme.bpmn.autolayout.layout.models.CollaborationLayout;
import org.prossme.bpmn.autolayout.layout.models.LaneBand;
import org.prossme.bpmn.autolayout.layout.models.Layout;
import org.prossme.bpmn.autolayout.layout.models.Point;
import org.prossme.bpmn.autolayout.layout.models.SubProcessLayout;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a computed layout as BPMN diagram interchange: one {@code bpmndi:BPMNDiagram} document
 * per plane. Coordinates are rounded to whole pixels here and nowhere else.
 */
public class DiagramInterchangeSerializer {
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";

    /**
     * The main diagram of a process followed by one drill-down diagram per collapsed sub-process
     * with a body, depth first. Every node of the graph tree gets exactly one shape across the
     * returned diagrams.
     */
    public static List<Document> serialize(ProcessGraph graph, Layout layout) {
        List<Document> diagrams = new ArrayList<>();
        DiagramWriter writer = new DiagramWriter(graph.id());
        writer.writeLanes(layout.laneBands());
        writer.writeGraph(graph, layout);
        diagrams.add(writer.document);

        writeDrillDowns(graph, layout, diagrams);
        return diagrams;
    }

    /**
     * One diagram for the whole collaboration: pools, their lanes and contents, then message flows.
     */
    public static List<Document> serializeCollaboration(BpmnData data, CollaborationLayout layout) {
        List<Document> diagrams = new ArrayList<>();
        DiagramWriter writer = new DiagramWriter(layout.collaborationId());

        for (Participant participant : data.collaboration().participants()) {
            Bounds poolBounds = layout.participantBounds().get(participant.id());
            if (poolBounds == null) {
                throw new IllegalStateException("Layout has no bounds for participant '" + participant.id() + "'");
            }
            Element shape = writer.shape(participant.id(), poolBounds);
            shape.setAttribute("isHorizontal", "true");

            Layout processLayout = layout.processLayouts().get(participant.id());
            ProcessGraph process = participant.processRef() == null
                    ? null
                    : data.findProcess(participant.processRef()).orElse(null);
            if (process != null && processLayout != null) {
                writer.writeLanes(processLayout.laneBands());
                writer.writeGraph(process, processLayout);
            }
        }

        for (MessageFlow messageFlow : data.collaboration().messageFlows()) {
            List<Point> points = layout.messageFlowWaypoints().get(messageFlow.id());
            if (points == null) {
                throw new IllegalStateException("Layout has no waypoints for message flow '" + messageFlow.id() + "'");
            }
            writer.edge(messageFlow.id(), points);
        }
        diagrams.add(writer.document);

        for (Participant participant : data.collaboration().participants()) {
            Layout processLayout = layout.processLayouts().get(participant.id());
            if (processLayout != null) {
                data.findProcess(participant.processRef())
                        .ifPresent(process -> writeDrillDowns(process, processLayout, diagrams));
            }
        }
        return diagrams;
    }

    private static void writeDrillDowns(ProcessGraph graph, Layout layout, List<Document> diagrams) {
        for (FlowNode node : graph.nodes()) {
            SubProcessLayout sub = layout.subLayouts().get(node.id());
            if (sub == null) {
                continue;
            }
            Layout body = sub.positioned();
            if (!sub.expanded()) {
                DiagramWriter writer = new DiagramWriter(node.id());
                writer.writeGraph(node.body(), body);
                diagrams.add(writer.document);
            }
            writeDrillDowns(node.body(), body, diagrams);
        }
    }

    /**
     * Builds one diagram document. Ids stay unique within the document even when nested scopes
     * reuse an element id.
     */
    private static class DiagramWriter {
        private final Document document;
        private final Element plane;
        private final Set<String> usedIds = new HashSet<>();

        DiagramWriter(String elementId) {
            document = newDocument();

            Element diagram = document.createElementNS(BPMNDI_NS, "bpmndi:BPMNDiagram");
            diagram.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:bpmndi", BPMNDI_NS);
            diagram.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:dc", DC_NS);
            diagram.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:di", DI_NS);
            diagram.setAttribute("id", uniqueId("BPMNDiagram_" + elementId));
            document.appendChild(diagram);

            plane = document.createElementNS(BPMNDI_NS, "bpmndi:BPMNPlane");
            plane.setAttribute("id", uniqueId("BPMNPlane_" + elementId));
            plane.setAttribute("bpmnElement", elementId);
            diagram.appendChild(plane);
        }

        void writeLanes(List<LaneBand> bands) {
            for (LaneBand band : bands) {
                Element shape = shape(band.laneId(), new Bounds(band.x(), band.y(), band.width(), band.height()));
                shape.setAttribute("isHorizontal", "true");
            }
        }

        /**
         * Node shapes (with expanded bodies right after their sub-process), then the graph's edges.
         */
        void writeGraph(ProcessGraph graph, Layout layout) {
            for (FlowNode node : graph.nodes()) {
                Element shape = shape(node.id(), layout.boundsOf(node.id()));
                if (node.isSubProcess()) {
                    shape.setAttribute("isExpanded", String.valueOf(node.expanded()));
                }
                if (node.type() == NodeType.EXCLUSIVE_GATEWAY) {
                    shape.setAttribute("isMarkerVisible", "true");
                }

                SubProcessLayout sub = layout.subLayouts().get(node.id());
                if (sub != null && sub.expanded()) {
                    writeGraph(node.body(), sub.positioned());
                }
            }

            for (SequenceFlow flow : graph.flows()) {
                List<Point> points = layout.flowWaypoints().get(flow.id());
                if (points == null) {
                    throw new IllegalStateException("Layout has no waypoints for flow '" + flow.id() + "'");
                }
                edge(flow.id(), points);
            }
        }

        Element shape(String elementId, Bounds bounds) {
            Element shape = document.createElementNS(BPMNDI_NS, "bpmndi:BPMNShape");
            shape.setAttribute("id", uniqueId("Shape_" + elementId));
            shape.setAttribute("bpmnElement", elementId);

            Element dcBounds = document.createElementNS(DC_NS, "dc:Bounds");
            dcBounds.setAttribute("x", round(bounds.x()));
            dcBounds.setAttribute("y", round(bounds.y()));
            dcBounds.setAttribute("width", round(bounds.width()));
            dcBounds.setAttribute("height", round(bounds.height()));
            shape.appendChild(dcBounds);

            plane.appendChild(shape);
            return shape;
        }

        void edge(String elementId, List<Point> points) {
            Element edge = document.createElementNS(BPMNDI_NS, "bpmndi:BPMNEdge");
            edge.setAttribute("id", uniqueId("Edge_" + elementId));
            edge.setAttribute("bpmnElement", elementId);

            for (Point point : points) {
                Element waypoint = document.createElementNS(DI_NS, "di:waypoint");
                waypoint.setAttribute("x", round(point.x()));
                waypoint.setAttribute("y", round(point.y()));
                edge.appendChild(waypoint);
            }
            plane.appendChild(edge);
        }

        private String uniqueId(String candidate) {
            String id = candidate;
            int suffix = 2;
            while (!usedIds.add(id)) {
                id = candidate + "_" + suffix++;
            }
            return id;
        }

        private static String round(double value) {
            return String.valueOf(Math.round(value));
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
}
