package com.pgschema.upgrader.exception;

import lombok.Getter;

/**
 * Driver-neutral failure of a single database call.
 * Both execution strategies translate their driver exceptions into this type.
 */
@Getter
public class DatabaseOperationException extends MigrationException {

    /**
     * SQLSTATE reported by the server, or null when the failure happened client side.
     */
    private final String sqlState;

    public DatabaseOperationException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }
}
