package com.pgschema.upgrader.exception;

import com.pgschema.upgrader.model.StepKey;

/**
 * An already applied step no longer has the content recorded in the ledger.
 */
public class TamperDetectedException extends IntegrityException {

    public TamperDetectedException(StepKey stepKey, String message) {
        super(stepKey, message);
    }
}
