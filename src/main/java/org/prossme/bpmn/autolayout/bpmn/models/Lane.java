package org.prossme.bpmn.autolayout.bpmn.models;

import java.util.List;

public record Lane(
        String id,
        String name,
        List<String> flowNodeRefs // list of node IDs (exactly like <flowNodeRef>)
) {
    public Lane {
        flowNodeRefs = flowNodeRefs == null ? List.of() : List.copyOf(flowNodeRefs);
    }

    public Lane withFlowNodeRefs(List<String> refs) {
        return new Lane(id, name, refs);
    }
}
