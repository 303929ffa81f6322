package com.pgschema.upgrader.orchestration;

import reactor.core.publisher.Mono;

/**
 * Interface for upgrade phases.
 * Each phase represents a distinct step in the upgrade lifecycle.
 */
public interface UpgradePhase {

    /**
     * Execute this phase of the upgrade.
     *
     * @param context The upgrade context for the current run
     * @return completion, or the typed failure of the phase
     */
    Mono<Void> execute(UpgradeContext context);

    /**
     * Get the name of this phase for logging.
     */
    String getPhaseName();

    /**
     * Check if this phase should be skipped based on context.
     * Default implementation never skips.
     */
    default boolean shouldSkip(UpgradeContext context) {
        return false;
    }
}
