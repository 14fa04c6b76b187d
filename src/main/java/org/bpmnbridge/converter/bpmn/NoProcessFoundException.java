package org.bpmnbridge.converter.bpmn;

/**
 * Thrown when a document contains no process block at all, so there is nothing to convert.
 */
public class NoProcessFoundException extends RuntimeException {

    public NoProcessFoundException(String message) {
        super(message);
    }
}
