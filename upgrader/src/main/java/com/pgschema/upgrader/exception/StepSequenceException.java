package com.pgschema.upgrader.exception;

/**
 * Step ids inside a file have a gap or a duplicate.
 */
public class StepSequenceException extends StepSourceException {

    public StepSequenceException(String message, String fileName) {
        super(message, fileName);
    }
}
