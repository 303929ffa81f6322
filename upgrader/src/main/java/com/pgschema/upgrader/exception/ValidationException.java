package com.pgschema.upgrader.exception;

/**
 * Exception thrown when validation checks fail.
 * Raised before any database mutation of the run.
 */
public class ValidationException extends MigrationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
