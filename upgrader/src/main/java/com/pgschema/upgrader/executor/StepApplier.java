package com.pgschema.upgrader.executor;

import com.pgschema.upgrader.exception.LedgerWriteException;
import com.pgschema.upgrader.exception.SqlExecutionException;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.model.StepKey;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.model.UpgraderStep;
import com.pgschema.upgrader.session.DatabaseSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Applies one step in its own transaction: SQL, then the ledger row, then commit.
 * Any failure rolls the step back. There are no retries.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StepApplier {

    private static final int SQL_PREVIEW_LENGTH = 200;

    private final LedgerAccessor ledgerAccessor;

    public Mono<StepKey> apply(DatabaseSession session, UpgraderStep step, UpgraderOptions options) {
        StepKey key = step.getKey();

        Mono<Void> transaction = session.beginTransaction()
            .onErrorMap(e -> new SqlExecutionException(key,
                "Failed to begin transaction for step " + key + ": " + e.getMessage(), e))
            .then(executeSql(session, step, options))
            .then(ledgerAccessor.record(session, step, options))
            .then(session.commit()
                .onErrorMap(e -> new SqlExecutionException(key,
                    "Failed to commit step " + key + ": " + e.getMessage(), e)));

        return transaction
            .onErrorResume(error -> rollback(session, key, error))
            .thenReturn(key);
    }

    private Mono<Void> executeSql(DatabaseSession session, UpgraderStep step, UpgraderOptions options) {
        StepKey key = step.getKey();
        return Mono.defer(() -> {
            log.info("Applying step {} - {}", key, step.getDescription());
            String sql = options.applySchemaSubstitution(step.getSqlText());
            log.debug("Step {} SQL: {}", key, preview(sql));
            return session.executeScript(sql);
        }).onErrorMap(
            e -> !(e instanceof SqlExecutionException),
            e -> new SqlExecutionException(key, "Step " + key + " failed: " + e.getMessage(), e)
        );
    }

    /**
     * Roll back and re-signal the original failure. A failing rollback is attached as suppressed.
     */
    private Mono<Void> rollback(DatabaseSession session, StepKey key, Throwable error) {
        if (error instanceof LedgerWriteException) {
            log.error("Step {} executed but could not be recorded, rolling back: {}", key, error.getMessage());
        } else {
            log.error("Step {} failed, rolling back: {}", key, error.getMessage());
        }

        return session.rollback()
            .onErrorResume(rollbackError -> {
                log.error("Rollback of step {} failed: {}", key, rollbackError.getMessage());
                error.addSuppressed(rollbackError);
                return Mono.empty();
            })
            .then(Mono.error(error));
    }

    private static String preview(String sql) {
        return sql.length() > SQL_PREVIEW_LENGTH ? sql.substring(0, SQL_PREVIEW_LENGTH) + "..." : sql;
    }
}
