package com.pgschema.upgrader.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a successful run.
 */
@Value
public class UpgradeReport {

    String runId;
    int totalSteps;
    int alreadyApplied;
    List<StepKey> appliedSteps;

    public UpgradeReport(String runId, int totalSteps, int alreadyApplied, List<StepKey> appliedSteps) {
        this.runId = runId;
        this.totalSteps = totalSteps;
        this.alreadyApplied = alreadyApplied;
        this.appliedSteps = List.copyOf(appliedSteps);
    }

    public boolean isNoOp() {
        return appliedSteps.isEmpty();
    }
}
