package com.pgschema.upgrader.integrity;

import com.pgschema.upgrader.exception.HistoryContinuityException;
import com.pgschema.upgrader.exception.TamperDetectedException;
import com.pgschema.upgrader.model.LedgerRecord;
import com.pgschema.upgrader.model.StepKey;
import com.pgschema.upgrader.model.UpgraderStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reconciles the on-disk step sequence with the ledger.
 * Pure logic: no I/O, and nothing is executed unless validation passes as a whole.
 */
@Component
@Slf4j
public class IntegrityValidator {

    /**
     * Validate the ledger against the full step sequence and return the steps still to apply.
     *
     * @param sequence the full step sequence, ordered by file id then step id
     * @param history  ledger records, ordered by file id then step id
     * @return the pending steps, in apply order
     * @throws HistoryContinuityException if the ledger is not an unbroken prefix of the sequence
     * @throws TamperDetectedException if an applied step's content changed on disk
     */
    public List<UpgraderStep> validate(List<UpgraderStep> sequence, List<LedgerRecord> history) {
        verifyChronology(history);

        int position = 0;
        for (LedgerRecord record : history) {
            StepKey recorded = record.getKey();

            if (position >= sequence.size()) {
                throw new HistoryContinuityException(recorded, String.format(
                    "Ledger records step %s, which is missing from the migration directory", recorded));
            }

            UpgraderStep expected = sequence.get(position);
            int order = recorded.compareTo(expected.getKey());
            if (order < 0) {
                throw new HistoryContinuityException(recorded, String.format(
                    "Ledger records step %s, which is missing from the migration directory (next on disk is %s)",
                    recorded, expected.getKey()));
            }
            if (order > 0) {
                // Unapplied step sorts before an applied one: it was inserted, not appended.
                throw new HistoryContinuityException(expected.getKey(), String.format(
                    "Step %s is not in the ledger but precedes the applied step %s; new steps may only be appended",
                    expected.getKey(), recorded));
            }

            if (!expected.hasSameContent(record)) {
                throw new TamperDetectedException(recorded, String.format(
                    "Step %s was modified after it was applied (%s differs from the ledger)",
                    recorded, describeDifference(expected, record)));
            }
            position++;
        }

        List<UpgraderStep> pending = List.copyOf(sequence.subList(position, sequence.size()));
        log.debug("{} of {} steps already applied, {} pending", position, sequence.size(), pending.size());
        return pending;
    }

    /**
     * Ledger rows in key order must also be in apply order.
     */
    private void verifyChronology(List<LedgerRecord> history) {
        LedgerRecord previous = null;
        for (LedgerRecord record : history) {
            if (previous != null
                && previous.getAppliedAt() != null
                && record.getAppliedAt() != null
                && record.getAppliedAt().isBefore(previous.getAppliedAt())) {
                throw new HistoryContinuityException(record.getKey(), String.format(
                    "Step %s was applied at %s, before the preceding step %s (%s)",
                    record.getKey(), record.getAppliedAt(), previous.getKey(), previous.getAppliedAt()));
            }
            previous = record;
        }
    }

    private static String describeDifference(UpgraderStep step, LedgerRecord record) {
        boolean descriptionChanged = !step.getDescription().equals(record.getDescription());
        boolean sqlChanged = !step.getSqlText().equals(record.getSqlText());
        if (descriptionChanged && sqlChanged) {
            return "description and SQL";
        }
        return descriptionChanged ? "description" : "SQL";
    }
}
