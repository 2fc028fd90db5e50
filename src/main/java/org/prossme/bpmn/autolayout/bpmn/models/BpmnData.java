package org.prossme.bpmn.autolayout.bpmn.models;

import java.util.List;
import java.util.Optional;

/**
 * A parsed BPMN definitions document: its processes and, when several pools exist, the
 * collaboration wrapping them.
 */
public record BpmnData(
        String id,
        String targetNamespace,
        Collaboration collaboration,
        List<ProcessGraph> processes
) {
    public BpmnData {
        processes = processes == null ? List.of() : List.copyOf(processes);
    }

    public Optional<ProcessGraph> findProcess(String processId) {
        return processes.stream()
                .filter(process -> process.id().equals(processId))
                .findFirst();
    }

    public BpmnData withProcesses(List<ProcessGraph> newProcesses) {
        return new BpmnData(id, targetNamespace, collaboration, newProcesses);
    }
}
