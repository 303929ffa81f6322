package com.pgschema.upgrader.exception;

import com.pgschema.upgrader.model.StepKey;
import lombok.Getter;

/**
 * Exception thrown when a step's SQL, or the commit of its transaction, fails.
 */
@Getter
public class SqlExecutionException extends MigrationException {

    private final StepKey stepKey;

    public SqlExecutionException(StepKey stepKey, String message, Throwable cause) {
        super(message, cause);
        this.stepKey = stepKey;
    }
}
