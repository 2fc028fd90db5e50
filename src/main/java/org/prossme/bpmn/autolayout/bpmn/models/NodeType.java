package org.prossme.bpmn.autolayout.bpmn.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Flow node kinds understood by the layout engine, keyed by their BPMN 2.0 element name.
 */
public enum NodeType {
    START_EVENT("startEvent", NodeCategory.EVENT),
    END_EVENT("endEvent", NodeCategory.EVENT),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent", NodeCategory.EVENT),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent", NodeCategory.EVENT),
    BOUNDARY_EVENT("boundaryEvent", NodeCategory.EVENT),

    TASK("task", NodeCategory.ACTIVITY),
    USER_TASK("userTask", NodeCategory.ACTIVITY),
    SERVICE_TASK("serviceTask", NodeCategory.ACTIVITY),
    SCRIPT_TASK("scriptTask", NodeCategory.ACTIVITY),
    MANUAL_TASK("manualTask", NodeCategory.ACTIVITY),
    SEND_TASK("sendTask", NodeCategory.ACTIVITY),
    RECEIVE_TASK("receiveTask", NodeCategory.ACTIVITY),
    BUSINESS_RULE_TASK("businessRuleTask", NodeCategory.ACTIVITY),
    CALL_ACTIVITY("callActivity", NodeCategory.ACTIVITY),

    EXCLUSIVE_GATEWAY("exclusiveGateway", NodeCategory.GATEWAY),
    PARALLEL_GATEWAY("parallelGateway", NodeCategory.GATEWAY),
    INCLUSIVE_GATEWAY("inclusiveGateway", NodeCategory.GATEWAY),
    EVENT_BASED_GATEWAY("eventBasedGateway", NodeCategory.GATEWAY),
    COMPLEX_GATEWAY("complexGateway", NodeCategory.GATEWAY),

    SUB_PROCESS("subProcess", NodeCategory.SUB_PROCESS);

    private final String elementName;
    private final NodeCategory category;

    NodeType(String elementName, NodeCategory category) {
        this.elementName = elementName;
        this.category = category;
    }

    public String elementName() {
        return elementName;
    }

    public NodeCategory category() {
        return category;
    }

    /**
     * Resolves a BPMN element name (e.g. "userTask"). The JSON structure format also spells
     * sub-processes as "subprocess", so the lookup ignores case.
     */
    public static Optional<NodeType> fromElementName(String elementName) {
        if (elementName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.elementName.equalsIgnoreCase(elementName))
                .findFirst();
    }
}
