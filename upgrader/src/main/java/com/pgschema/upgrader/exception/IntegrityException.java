package com.pgschema.upgrader.exception;

import com.pgschema.upgrader.model.StepKey;
import lombok.Getter;

/**
 * Exception thrown when the migration directory and the ledger disagree.
 */
@Getter
public class IntegrityException extends ValidationException {

    private final StepKey stepKey;

    public IntegrityException(StepKey stepKey, String message) {
        super(message);
        this.stepKey = stepKey;
    }
}
