package com.pgschema.upgrader.exception;

/**
 * A migration file name does not start with a numeric id.
 */
public class FileNamingException extends StepSourceException {

    public FileNamingException(String message, String fileName) {
        super(message, fileName);
    }
}
