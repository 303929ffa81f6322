package com.pgschema.upgrader.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single numbered SQL unit inside a migration file.
 * Applied in its own transaction.
 */
@Value
@Builder(toBuilder = true)
public class UpgraderStep {

    int fileId;
    int upgraderId;

    /**
     * Free text taken from the header line, trimmed.
     */
    String description;

    /**
     * SQL body up to the next header or end of file, trimmed.
     */
    String sqlText;

    public StepKey getKey() {
        return StepKey.of(fileId, upgraderId);
    }

    /**
     * Whether the content recorded in the ledger is exactly this step's content.
     */
    public boolean hasSameContent(LedgerRecord record) {
        return description.equals(record.getDescription()) && sqlText.equals(record.getSqlText());
    }
}
