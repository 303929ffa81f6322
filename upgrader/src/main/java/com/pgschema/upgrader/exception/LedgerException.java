package com.pgschema.upgrader.exception;

/**
 * Exception thrown when the ledger table cannot be created or read.
 */
public class LedgerException extends MigrationException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
