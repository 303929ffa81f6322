package com.pgschema.upgrader.exception;

import lombok.Getter;

/**
 * Exception thrown when the migration directory cannot be turned into a step sequence.
 */
@Getter
public class StepSourceException extends ValidationException {

    /**
     * Offending file or directory name, when one applies.
     */
    private final String fileName;

    public StepSourceException(String message, String fileName) {
        this(message, fileName, null);
    }

    public StepSourceException(String message, String fileName, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }
}
