package org.prossme.bpmn.autolayout.bpmn.models;

public record Participant(
        String id,
        String name,
        String processRef
) {}
