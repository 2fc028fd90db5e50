package org.prossme.bpmn.autolayout.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two nodes of the same process graph.
 *
 * @param id                  the unique identifier of the sequence flow
 * @param name                the name/label of the sequence flow, may be null
 * @param sourceRef           id of the source node
 * @param targetRef           id of the target node
 * @param conditionExpression the conditional expression for the flow (if any)
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef,
        String conditionExpression
) {
    // Constructor without expression (for unconditional flows)
    public SequenceFlow(String id, String sourceRef, String targetRef) {
        this(id, null, sourceRef, targetRef, null);
    }
}
