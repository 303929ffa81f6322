package com.pgschema.upgrader.exception;

/**
 * Exception thrown when database connection issues occur.
 * Covers transport, authentication and TLS negotiation failures.
 */
public class ConnectionException extends MigrationException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
