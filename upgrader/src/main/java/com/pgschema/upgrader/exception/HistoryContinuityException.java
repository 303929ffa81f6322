package com.pgschema.upgrader.exception;

import com.pgschema.upgrader.model.StepKey;

/**
 * The ledger is not an unbroken prefix of the on-disk step sequence.
 */
public class HistoryContinuityException extends IntegrityException {

    public HistoryContinuityException(StepKey stepKey, String message) {
        super(stepKey, message);
    }
}
