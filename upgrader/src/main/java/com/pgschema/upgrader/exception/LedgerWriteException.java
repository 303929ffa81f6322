package com.pgschema.upgrader.exception;

import com.pgschema.upgrader.model.StepKey;
import lombok.Getter;

/**
 * Exception thrown when recording an applied step fails after its SQL succeeded.
 * The step transaction is rolled back together with the SQL.
 */
@Getter
public class LedgerWriteException extends LedgerException {

    private final StepKey stepKey;

    public LedgerWriteException(StepKey stepKey, Throwable cause) {
        super("Failed to record step " + stepKey + " in the ledger: " + cause.getMessage(), cause);
        this.stepKey = stepKey;
    }
}
