package com.pgschema.upgrader.exception;

/**
 * Exception thrown when the target schema is missing and may not be created,
 * or when creating or activating it fails.
 */
public class SchemaCreationException extends MigrationException {

    public SchemaCreationException(String message) {
        super(message);
    }

    public SchemaCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
