package org.prossme.bpmn.autolayout.bpmn.models;

public enum NodeCategory {
    EVENT,
    ACTIVITY,
    GATEWAY,
    SUB_PROCESS
}
