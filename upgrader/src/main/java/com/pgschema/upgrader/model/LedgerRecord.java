package com.pgschema.upgrader.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * A row of the ledger table: one step that was applied and committed.
 */
@Value
@Builder(toBuilder = true)
public class LedgerRecord {

    int fileId;
    int upgraderId;
    String description;
    String sqlText;
    OffsetDateTime appliedAt;

    public StepKey getKey() {
        return StepKey.of(fileId, upgraderId);
    }
}
