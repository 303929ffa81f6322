package com.pgschema.upgrader.orchestration;

import com.pgschema.upgrader.executor.StepApplier;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.integrity.IntegrityValidator;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.orchestration.phases.IntegrityValidationPhase;
import com.pgschema.upgrader.orchestration.phases.LedgerBootstrapPhase;
import com.pgschema.upgrader.orchestration.phases.SchemaPreparationPhase;
import com.pgschema.upgrader.orchestration.phases.SessionLockPhase;
import com.pgschema.upgrader.orchestration.phases.StepApplicationPhase;
import com.pgschema.upgrader.session.ExecutionStrategy;
import com.pgschema.upgrader.source.StepSourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrator for the upgrade lifecycle.
 * Parses the migration directory, then runs the phases in sequence over one session.
 *
 * <p>Written once against {@link ExecutionStrategy}; the caller picks the strategy.
 */
@Service
@Slf4j
public class UpgradeOrchestrator {

    private final StepSourceParser stepSourceParser;
    private final LedgerAccessor ledgerAccessor;

    // Phase implementations, in execution order
    private final List<UpgradePhase> phases;

    public UpgradeOrchestrator(
            StepSourceParser stepSourceParser,
            LedgerAccessor ledgerAccessor,
            SessionLockPhase sessionLockPhase,
            SchemaPreparationPhase schemaPreparationPhase,
            LedgerBootstrapPhase ledgerBootstrapPhase,
            IntegrityValidationPhase integrityValidationPhase,
            StepApplicationPhase stepApplicationPhase) {
        this.stepSourceParser = stepSourceParser;
        this.ledgerAccessor = ledgerAccessor;
        this.phases = List.of(
            sessionLockPhase,
            schemaPreparationPhase,
            ledgerBootstrapPhase,
            integrityValidationPhase,
            stepApplicationPhase
        );
    }

    /**
     * Wire the orchestrator and its phases without a Spring context.
     */
    public static UpgradeOrchestrator create(LedgerAccessor ledgerAccessor) {
        return new UpgradeOrchestrator(
            new StepSourceParser(),
            ledgerAccessor,
            new SessionLockPhase(ledgerAccessor),
            new SchemaPreparationPhase(ledgerAccessor),
            new LedgerBootstrapPhase(ledgerAccessor),
            new IntegrityValidationPhase(ledgerAccessor, new IntegrityValidator()),
            new StepApplicationPhase(new StepApplier(ledgerAccessor))
        );
    }

    /**
     * Execute the complete upgrade lifecycle.
     *
     * @param strategy  how database work is scheduled
     * @param directory the flat migration directory
     * @param target    the database to upgrade
     * @param options   schema and TLS options
     * @return the run report; errors are signalled as typed {@code MigrationException}s
     */
    public Mono<UpgradeReport> upgrade(
            ExecutionStrategy strategy,
            Path directory,
            ConnectionTarget target,
            UpgraderOptions options) {

        return Mono.defer(() -> {
            String runId = newRunId();
            log.info("[Run-{}] ========== UPGRADE STARTED ==========", runId);
            log.info("[Run-{}] Directory: {}, target: {}, strategy: {}",
                runId, directory, target.describe(), strategy.getName());

            // Parse before connecting: a bad directory never touches the database
            return strategy.fromBlocking(() -> stepSourceParser.parse(directory))
                .doOnNext(steps -> log.info("[Run-{}] Loaded {} steps from {}", runId, steps.size(), directory))
                .flatMap(steps -> Mono.usingWhen(
                    strategy.connect(target, options.getSslMode())
                        .map(session -> new UpgradeContext(runId, session, options, steps)),
                    this::executePhases,
                    this::release
                ))
                .doOnSuccess(report -> {
                    log.info("[Run-{}] Applied {} new steps ({} already applied)",
                        runId, report.getAppliedSteps().size(), report.getAlreadyApplied());
                    log.info("[Run-{}] ========== UPGRADE COMPLETE ==========", runId);
                })
                .doOnError(e -> {
                    log.error("[Run-{}] ========== UPGRADE FAILED ==========", runId);
                    log.error("[Run-{}] Error: {}", runId, e.getMessage());
                });
        });
    }

    private Mono<UpgradeReport> executePhases(UpgradeContext context) {
        return Flux.fromIterable(phases)
            .concatMap(phase -> executePhaseIfNeeded(phase, context))
            .then(Mono.fromSupplier(context::toReport));
    }

    /**
     * Execute a phase if it shouldn't be skipped.
     */
    private Mono<Void> executePhaseIfNeeded(UpgradePhase phase, UpgradeContext context) {
        return Mono.defer(() -> {
            if (phase.shouldSkip(context)) {
                log.info("[Run-{}] Skipping phase: {}", context.getRunId(), phase.getPhaseName());
                return Mono.<Void>empty();
            }

            log.info("[Run-{}] Starting phase: {}", context.getRunId(), phase.getPhaseName());
            return phase.execute(context)
                .doOnSuccess(v -> log.info("[Run-{}] Completed phase: {}", context.getRunId(), phase.getPhaseName()))
                .doOnError(e -> log.error("[Run-{}] Failed phase: {}", context.getRunId(), phase.getPhaseName()));
        });
    }

    /**
     * Release the lock (if taken) and close the session. Runs on every exit path.
     */
    private Mono<Void> release(UpgradeContext context) {
        Mono<Void> unlock = context.isLockAcquired()
            ? ledgerAccessor.releaseLock(context.getSession())
                .onErrorResume(e -> {
                    log.warn("[Run-{}] Failed to release upgrade lock: {}", context.getRunId(), e.getMessage());
                    return Mono.empty();
                })
            : Mono.empty();

        return unlock
            .then(context.getSession().close())
            .onErrorResume(e -> {
                log.warn("[Run-{}] Failed to close session: {}", context.getRunId(), e.getMessage());
                return Mono.empty();
            })
            .doOnSuccess(v -> log.debug("[Run-{}] Session released", context.getRunId()));
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
