package com.pgschema.upgrader.ledger;

import com.pgschema.upgrader.exception.LedgerException;
import com.pgschema.upgrader.exception.LedgerWriteException;
import com.pgschema.upgrader.exception.SchemaCreationException;
import com.pgschema.upgrader.model.LedgerRecord;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.model.UpgraderStep;
import com.pgschema.upgrader.session.DatabaseSession;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads and writes the ledger of applied steps, and prepares the schema it lives in.
 *
 * <p>Written once against {@link DatabaseSession}, so it behaves the same under
 * either execution strategy.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerAccessor {

    public static final String LEDGER_TABLE = "$upgraders$";
    public static final long DEFAULT_LOCK_KEY = 42004200L;

    @Getter
    private final long lockKey;

    public LedgerAccessor() {
        this(DEFAULT_LOCK_KEY);
    }

    /**
     * Take the session-level advisory lock that serializes concurrent runs.
     * Waits until any other run against the same database releases it.
     */
    public Mono<Void> acquireLock(DatabaseSession session) {
        return session.query("SELECT pg_advisory_lock(?)", row -> Boolean.TRUE, lockKey)
            .then();
    }

    public Mono<Void> releaseLock(DatabaseSession session) {
        return session.query("SELECT pg_advisory_unlock(?)", row -> Boolean.TRUE, lockKey)
            .then();
    }

    /**
     * Make the configured schema the active search path, creating it first when allowed.
     * Does nothing without a schema.
     */
    public Mono<Void> prepareSchema(DatabaseSession session, UpgraderOptions options) {
        if (options.getSchema() == null) {
            return Mono.empty();
        }
        String schema = options.getSchema();

        return schemaExists(session, schema)
            .flatMap(exists -> {
                if (exists) {
                    log.info("✓ Schema '{}' already exists", schema);
                    return Mono.<Void>empty();
                }
                if (!options.isCreateSchema()) {
                    return Mono.<Void>error(new SchemaCreationException(
                        "Schema '" + schema + "' does not exist and schema creation is disabled"));
                }
                return session.executeScript("CREATE SCHEMA IF NOT EXISTS " + quoteIdentifier(schema))
                    .doOnSuccess(v -> log.info("✓ Schema '{}' created", schema));
            })
            .then(session.executeScript("SET search_path TO " + quoteIdentifier(schema)))
            .onErrorMap(
                e -> !(e instanceof SchemaCreationException),
                e -> new SchemaCreationException("Failed to prepare schema '" + schema + "': " + e.getMessage(), e)
            );
    }

    private Mono<Boolean> schemaExists(DatabaseSession session, String schema) {
        return session.query("SELECT 1 AS present FROM pg_namespace WHERE nspname = ?", row -> Boolean.TRUE, schema)
            .hasElements();
    }

    /**
     * Create the ledger table if it is absent. Runs outside any step transaction.
     */
    public Mono<Void> bootstrap(DatabaseSession session, UpgraderOptions options) {
        String table = tableName(options);
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " ("
            + "file_id INTEGER NOT NULL, "
            + "upgrader_id INTEGER NOT NULL, "
            + "description TEXT NOT NULL, "
            + "sql_text TEXT NOT NULL, "
            + "applied_at TIMESTAMPTZ NOT NULL DEFAULT now(), "
            + "PRIMARY KEY (file_id, upgrader_id))";

        return session.executeScript(ddl)
            .doOnSuccess(v -> log.debug("Ledger table {} is present", table))
            .onErrorMap(
                e -> !(e instanceof LedgerException),
                e -> new LedgerException("Failed to create ledger table " + table + ": " + e.getMessage(), e)
            );
    }

    /**
     * All ledger records, ordered by file id then step id.
     */
    public Mono<List<LedgerRecord>> readHistory(DatabaseSession session, UpgraderOptions options) {
        String table = tableName(options);
        String sql = "SELECT file_id, upgrader_id, description, sql_text, applied_at FROM " + table
            + " ORDER BY file_id, upgrader_id";

        Flux<LedgerRecord> records = session.query(sql, row -> LedgerRecord.builder()
            .fileId(row.getInt("file_id"))
            .upgraderId(row.getInt("upgrader_id"))
            .description(row.getString("description"))
            .sqlText(row.getString("sql_text"))
            .appliedAt(row.getTimestamp("applied_at"))
            .build());

        return records.collectList()
            .onErrorMap(
                e -> !(e instanceof LedgerException),
                e -> new LedgerException("Failed to read ledger table " + table + ": " + e.getMessage(), e)
            );
    }

    /**
     * Record a step inside the caller's open transaction. The unsubstituted SQL text is stored.
     */
    public Mono<Void> record(DatabaseSession session, UpgraderStep step, UpgraderOptions options) {
        String sql = "INSERT INTO " + tableName(options)
            + " (file_id, upgrader_id, description, sql_text, applied_at) VALUES (?, ?, ?, ?, now())";

        return session.update(sql, step.getFileId(), step.getUpgraderId(), step.getDescription(), step.getSqlText())
            .onErrorMap(
                e -> !(e instanceof LedgerWriteException),
                e -> new LedgerWriteException(step.getKey(), e)
            )
            .then();
    }

    /**
     * Ledger table name, qualified with the schema when one is configured.
     */
    public String tableName(UpgraderOptions options) {
        return options.schemaName()
            .map(schema -> quoteIdentifier(schema) + "." + quoteIdentifier(LEDGER_TABLE))
            .orElse(quoteIdentifier(LEDGER_TABLE));
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
