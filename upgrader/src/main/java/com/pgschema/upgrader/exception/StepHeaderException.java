package com.pgschema.upgrader.exception;

/**
 * A step header line is malformed, or SQL sits outside any step.
 */
public class StepHeaderException extends StepSourceException {

    public StepHeaderException(String message, String fileName) {
        super(message, fileName);
    }
}
