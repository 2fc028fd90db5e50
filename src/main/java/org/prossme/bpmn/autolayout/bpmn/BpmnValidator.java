package org.prossme.bpmn.autolayout.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

/**
 * Schema validation of BPMN markup through the Camunda model API.
 */
public class BpmnValidator {

    /**
     * Validates BPMN markup, diagram interchange included.
     * Throws an exception if invalid.
     */
    public static void validate(String xml) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
    }

    /**
     * Validates a laid out file on disk.
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
    }

    /**
     * Same as {@link #validate(String)}, reporting the outcome instead of throwing.
     */
    public static boolean isValid(String xml) {
        try {
            validate(xml);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
