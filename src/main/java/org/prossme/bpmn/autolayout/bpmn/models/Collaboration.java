package org.prossme.bpmn.autolayout.bpmn.models;

import java.util.List;

public record Collaboration(
        String id,
        List<Participant> participants,
        List<MessageFlow> messageFlows
) {
    public Collaboration {
        participants = participants == null ? List.of() : List.copyOf(participants);
        messageFlows = messageFlows == null ? List.of() : List.copyOf(messageFlows);
    }
}
