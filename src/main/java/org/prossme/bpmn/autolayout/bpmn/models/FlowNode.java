package org.prossme.bpmn.autolayout.bpmn.models;

import lombok.Builder;

@Builder(toBuilder = true)
public record FlowNode(
        String id,
        String name,
        NodeType type,

        //for boundary events
        String attachedToRef,

        //for sub-processes
        boolean expanded,
        boolean triggeredByEvent,
        ProcessGraph body
) {
    public FlowNode {
        if (type == null) {
            type = NodeType.TASK;
        }
    }

    // Constructor for plain nodes without attachment or body
    public FlowNode(String id, String name, NodeType type) {
        this(id, name, type, null, false, false, null);
    }

    public NodeCategory category() {
        return type.category();
    }

    /**
     * Boundary events that name a host are positioned on the host, not in a column.
     */
    public boolean isAttachedBoundaryEvent() {
        return type == NodeType.BOUNDARY_EVENT && attachedToRef != null && !attachedToRef.isBlank();
    }

    public boolean isSubProcess() {
        return type == NodeType.SUB_PROCESS;
    }

    public boolean hasBody() {
        return body != null && !body.nodes().isEmpty();
    }

    public String displayName() {
        return name != null ? name : "";
    }
}
