package org.bpmnbridge.converter.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public class BpmnValidator {

    /**
     * Validates generated BPMN text against the BPMN 2.0 schema.
     * Throws an exception if invalid.
     */
    public static void validate(String bpmnXml) {
        InputStream is = new ByteArrayInputStream(bpmnXml.getBytes(StandardCharsets.UTF_8));
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String bpmnXml) {
        try {
            validate(bpmnXml);
            return true;
        } catch (Exception e) {
            return false;
        }
    }
}
