package com.pgschema.upgrader.orchestration;

import com.pgschema.upgrader.model.LedgerRecord;
import com.pgschema.upgrader.model.StepKey;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.model.UpgraderStep;
import com.pgschema.upgrader.session.DatabaseSession;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Context object that carries state through one upgrade run.
 * Shared across all phases; phases run strictly one after another.
 */
@Data
public class UpgradeContext {

    private final String runId;
    private final DatabaseSession session;
    private final UpgraderOptions options;

    // Full step sequence parsed from disk
    private final List<UpgraderStep> steps;

    // Filled by the validation phase
    private List<LedgerRecord> history = List.of();
    private List<UpgraderStep> pendingSteps = List.of();

    // Steps committed by this run, in order
    private final List<StepKey> appliedSteps = new ArrayList<>();

    private boolean lockAcquired;

    public UpgradeContext(String runId, DatabaseSession session, UpgraderOptions options, List<UpgraderStep> steps) {
        this.runId = runId;
        this.session = session;
        this.options = options;
        this.steps = List.copyOf(steps);
    }

    public void markApplied(StepKey key) {
        appliedSteps.add(key);
    }

    public UpgradeReport toReport() {
        return new UpgradeReport(runId, steps.size(), history.size(), appliedSteps);
    }
}
