package org.prossme.bpmn.autolayout.bpmn.models;

/**
 * A message flow between nodes owned by different participants of a collaboration.
 */
public record MessageFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef
) {}
