package com.pgschema.upgrader;

import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.infrastructure.database.DatabaseConnectionFactory;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.model.SslMode;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.orchestration.UpgradeOrchestrator;
import com.pgschema.upgrader.session.BlockingExecutionStrategy;
import com.pgschema.upgrader.session.ExecutionStrategy;
import com.pgschema.upgrader.session.ReactiveExecutionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Entry points of the upgrader.
 *
 * <p>{@link #upgrade} keeps all database work on the calling thread (JDBC);
 * {@link #upgradeAsync} suspends at every I/O boundary (R2DBC). Both share one engine,
 * the same ordering and the same typed errors.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaUpgrader {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final UpgradeOrchestrator orchestrator;
    private final BlockingExecutionStrategy blockingStrategy;
    private final ReactiveExecutionStrategy reactiveStrategy;

    /**
     * Wire the engine without a Spring context.
     */
    public static SchemaUpgrader withDefaults() {
        return create(DEFAULT_CONNECT_TIMEOUT, LedgerAccessor.DEFAULT_LOCK_KEY);
    }

    public static SchemaUpgrader create(Duration connectTimeout, long lockKey) {
        return new SchemaUpgrader(
            UpgradeOrchestrator.create(new LedgerAccessor(lockKey)),
            new BlockingExecutionStrategy(new DatabaseConnectionFactory(connectTimeout)),
            new ReactiveExecutionStrategy(connectTimeout)
        );
    }

    /**
     * Apply all pending steps, blocking the calling thread until done.
     *
     * @throws com.pgschema.upgrader.exception.MigrationException (a typed subclass) on failure
     */
    public UpgradeReport upgrade(Path directory, ConnectionTarget target, UpgraderOptions options) {
        return orchestrator.upgrade(blockingStrategy, directory, target, options).block();
    }

    /**
     * Apply all pending steps without blocking. Failures arrive on the error channel.
     */
    public Mono<UpgradeReport> upgradeAsync(Path directory, ConnectionTarget target, UpgraderOptions options) {
        return orchestrator.upgrade(reactiveStrategy, directory, target, options);
    }

    public void checkConnection(ConnectionTarget target, SslMode sslMode) {
        checkConnection(blockingStrategy, target, sslMode).block();
    }

    public Mono<Void> checkConnectionAsync(ConnectionTarget target, SslMode sslMode) {
        return checkConnection(reactiveStrategy, target, sslMode);
    }

    private Mono<Void> checkConnection(ExecutionStrategy strategy, ConnectionTarget target, SslMode sslMode) {
        return Mono.usingWhen(
                strategy.connect(target, sslMode),
                session -> session.query("SELECT 1 AS ok", row -> row.getInt("ok")).then(),
                session -> session.close()
            )
            .doOnSuccess(v -> log.info("✓ Connection to {} is working ({} strategy)", target.describe(), strategy.getName()));
    }
}
