package com.pgschema.upgrader.exception;

/**
 * Migration file ids have a gap or a duplicate.
 */
public class FileSequenceException extends StepSourceException {

    public FileSequenceException(String message, String fileName) {
        super(message, fileName);
    }
}
