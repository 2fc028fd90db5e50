package org.prossme.bpmn.autolayout.bpmn;

import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.MessageFlow;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.bpmn.models.SequenceFlow;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Referential integrity checks run before layout. Business-process semantics (missing start
 * events, unbalanced gateways...) are not checked here.
 */
public class StructureValidator {

    /**
     * Validates every process of a definitions document, plus participant and message flow
     * references of its collaboration. Ids of a markup document are unique across the whole
     * document, sub-process bodies included.
     *
     * @throws StructuralException on the first violation found
     */
    public static void validate(BpmnData bpmnData) {
        if (bpmnData.processes().isEmpty()) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "Definitions '" + bpmnData.id() + "' contain no process");
        }

        Set<String> processIds = new HashSet<>();
        Set<String> documentIds = new HashSet<>();
        for (ProcessGraph process : bpmnData.processes()) {
            if (!processIds.add(process.id())) {
                throw new StructuralException(StructuralException.Reason.DUPLICATE_ID,
                        "Process id '" + process.id() + "' is declared more than once");
            }
            validate(process);
            requireUniqueInDocument(process.id(), bpmnData, documentIds);
            collectDocumentIds(process, bpmnData, documentIds);
        }

        if (bpmnData.collaboration() == null) {
            return;
        }

        Set<String> messageEndpoints = new HashSet<>();
        for (Participant participant : bpmnData.collaboration().participants()) {
            messageEndpoints.add(participant.id());
            if (participant.processRef() != null && !processIds.contains(participant.processRef())) {
                throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                        String.format("Participant '%s' references unknown process '%s'",
                                participant.id(), participant.processRef()));
            }
        }
        bpmnData.processes().forEach(process -> collectNodeIds(process, messageEndpoints));

        for (MessageFlow messageFlow : bpmnData.collaboration().messageFlows()) {
            if (!messageEndpoints.contains(messageFlow.sourceRef())) {
                throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                        String.format("Message flow '%s' references unknown source '%s'",
                                messageFlow.id(), messageFlow.sourceRef()));
            }
            if (!messageEndpoints.contains(messageFlow.targetRef())) {
                throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                        String.format("Message flow '%s' references unknown target '%s'",
                                messageFlow.id(), messageFlow.targetRef()));
            }
        }
    }

    /**
     * Validates one process graph and, recursively, every sub-process body it owns.
     *
     * @throws StructuralException on the first violation found
     */
    public static void validate(ProcessGraph graph) {
        Set<String> scopeIds = new HashSet<>();
        for (FlowNode node : graph.nodes()) {
            requireId(node.id(), "node", graph);
            if (!scopeIds.add(node.id())) {
                throw new StructuralException(StructuralException.Reason.DUPLICATE_ID,
                        String.format("Node id '%s' is used more than once in '%s'", node.id(), graph.id()));
            }
        }

        Map<String, FlowNode> nodesById = graph.nodesById();

        for (SequenceFlow flow : graph.flows()) {
            requireId(flow.id(), "sequence flow", graph);
            if (!scopeIds.add(flow.id())) {
                throw new StructuralException(StructuralException.Reason.DUPLICATE_ID,
                        String.format("Sequence flow id '%s' collides with another element in '%s'",
                                flow.id(), graph.id()));
            }
            if (!nodesById.containsKey(flow.sourceRef())) {
                throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                        String.format("Sequence flow '%s' references unknown source node '%s'",
                                flow.id(), flow.sourceRef()));
            }
            if (!nodesById.containsKey(flow.targetRef())) {
                throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                        String.format("Sequence flow '%s' references unknown target node '%s'",
                                flow.id(), flow.targetRef()));
            }
        }

        for (Lane lane : graph.lanes()) {
            requireId(lane.id(), "lane", graph);
            if (!scopeIds.add(lane.id())) {
                throw new StructuralException(StructuralException.Reason.DUPLICATE_ID,
                        String.format("Lane id '%s' collides with another element in '%s'", lane.id(), graph.id()));
            }
            for (String ref : lane.flowNodeRefs()) {
                if (!nodesById.containsKey(ref)) {
                    throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                            String.format("Lane '%s' references unknown node '%s'", lane.id(), ref));
                }
            }
        }

        for (FlowNode node : graph.nodes()) {
            if (node.isAttachedBoundaryEvent()) {
                FlowNode host = nodesById.get(node.attachedToRef());
                if (host == null) {
                    throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                            String.format("Boundary event '%s' is attached to unknown node '%s'",
                                    node.id(), node.attachedToRef()));
                }
                if (host.type() == NodeType.BOUNDARY_EVENT) {
                    throw new StructuralException(StructuralException.Reason.DANGLING_REFERENCE,
                            String.format("Boundary event '%s' is attached to another boundary event '%s'",
                                    node.id(), host.id()));
                }
            }
            if (node.body() != null) {
                validate(node.body());
            }
        }
    }

    private static void requireId(String id, String kind, ProcessGraph graph) {
        if (id == null || id.isBlank()) {
            throw new StructuralException(StructuralException.Reason.UNDECODABLE,
                    "A " + kind + " in '" + graph.id() + "' has no id");
        }
    }

    private static void collectDocumentIds(ProcessGraph graph, BpmnData bpmnData, Set<String> documentIds) {
        for (FlowNode node : graph.nodes()) {
            requireUniqueInDocument(node.id(), bpmnData, documentIds);
            if (node.body() != null) {
                collectDocumentIds(node.body(), bpmnData, documentIds);
            }
        }
        graph.flows().forEach(flow -> requireUniqueInDocument(flow.id(), bpmnData, documentIds));
        graph.lanes().forEach(lane -> requireUniqueInDocument(lane.id(), bpmnData, documentIds));
    }

    private static void requireUniqueInDocument(String id, BpmnData bpmnData, Set<String> documentIds) {
        if (!documentIds.add(id)) {
            throw new StructuralException(StructuralException.Reason.DUPLICATE_ID,
                    String.format("Id '%s' is used more than once in definitions '%s'", id, bpmnData.id()));
        }
    }

    private static void collectNodeIds(ProcessGraph graph, Set<String> into) {
        for (FlowNode node : graph.nodes()) {
            into.add(node.id());
            if (node.body() != null) {
                collectNodeIds(node.body(), into);
            }
        }
    }
}
