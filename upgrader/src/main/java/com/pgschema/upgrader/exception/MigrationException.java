package com.pgschema.upgrader.exception;

/**
 * Base exception for all schema upgrade errors.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
