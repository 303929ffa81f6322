package com.pgschema.upgrader.orchestration;

import com.pgschema.upgrader.exception.ConnectionException;
import com.pgschema.upgrader.exception.FileSequenceException;
import com.pgschema.upgrader.exception.HistoryContinuityException;
import com.pgschema.upgrader.exception.LedgerWriteException;
import com.pgschema.upgrader.exception.SchemaCreationException;
import com.pgschema.upgrader.exception.SqlExecutionException;
import com.pgschema.upgrader.exception.TamperDetectedException;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.model.LedgerRecord;
import com.pgschema.upgrader.model.SslMode;
import com.pgschema.upgrader.model.StepKey;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import com.pgschema.upgrader.support.MigrationDirectory;
import com.pgschema.upgrader.support.RecordingDatabaseSession;
import com.pgschema.upgrader.support.RecordingExecutionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UpgradeOrchestrator")
class UpgradeOrchestratorTest {

    private static final ConnectionTarget TARGET = ConnectionTarget.builder()
        .host("db")
        .database("app")
        .user("app")
        .password("pw")
        .build();

    private static final String CREATE_TABLE = "CREATE TABLE t (id INT);";
    private static final String ADD_COLUMN = "ALTER TABLE t ADD COLUMN c TEXT;";
    private static final String CREATE_INDEX = "CREATE INDEX idx_t_c ON t (c);";

    @TempDir
    Path dir;

    private MigrationDirectory migrations;
    private RecordingDatabaseSession session;
    private RecordingExecutionStrategy strategy;
    private UpgradeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        migrations = MigrationDirectory.at(dir)
            .file("000_init.sql", "--- 0: Create table\n" + CREATE_TABLE + "\n--- 1: Add column\n" + ADD_COLUMN + "\n")
            .file("001_more.sql", "--- 0: Create index\n" + CREATE_INDEX + "\n");
        session = new RecordingDatabaseSession();
        strategy = new RecordingExecutionStrategy(session);
        orchestrator = UpgradeOrchestrator.create(new LedgerAccessor());
    }

    private UpgradeReport upgrade(UpgraderOptions options) {
        return orchestrator.upgrade(strategy, dir, TARGET, options).block();
    }

    private UpgradeReport upgrade() {
        return upgrade(UpgraderOptions.defaults());
    }

    private static LedgerRecord record(int fileId, int upgraderId, String description, String sql) {
        return LedgerRecord.builder()
            .fileId(fileId)
            .upgraderId(upgraderId)
            .description(description)
            .sqlText(sql)
            .appliedAt(OffsetDateTime.parse("2024-03-01T10:00:00Z").plusSeconds(fileId * 10L + upgraderId))
            .build();
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("applies every step in its own transaction, in order")
        void freshDatabase() {
            UpgradeReport report = upgrade();

            assertThat(report.getAppliedSteps())
                .containsExactly(StepKey.of(0, 0), StepKey.of(0, 1), StepKey.of(1, 0));
            assertThat(report.getTotalSteps()).isEqualTo(3);
            assertThat(report.getAlreadyApplied()).isZero();

            assertThat(session.callsStartingWith("LOCK", "HISTORY", "BEGIN", "EXEC ALTER", "EXEC CREATE INDEX",
                "EXEC CREATE TABLE t", "INSERT", "COMMIT", "UNLOCK", "CLOSE"))
                .containsExactly(
                    "LOCK",
                    "HISTORY",
                    "BEGIN", "EXEC " + CREATE_TABLE, "INSERT 0:0", "COMMIT",
                    "BEGIN", "EXEC " + ADD_COLUMN, "INSERT 0:1", "COMMIT",
                    "BEGIN", "EXEC " + CREATE_INDEX, "INSERT 1:0", "COMMIT",
                    "UNLOCK",
                    "CLOSE");
            assertThat(session.getLedger()).extracting(LedgerRecord::getKey)
                .containsExactly(StepKey.of(0, 0), StepKey.of(0, 1), StepKey.of(1, 0));
        }

        @Test
        @DisplayName("bootstraps the ledger table before reading history")
        void bootstrapsLedger() {
            upgrade();

            List<String> calls = session.getCalls();
            assertThat(calls.get(0)).isEqualTo("LOCK");
            assertThat(calls.get(1)).startsWith("EXEC CREATE TABLE IF NOT EXISTS \"$upgraders$\"");
            assertThat(calls.get(2)).isEqualTo("HISTORY");
        }

        @Test
        @DisplayName("a second run is a no-op")
        void idempotent() {
            upgrade();
            List<String> firstRunScripts = session.getCommittedScripts();

            UpgradeReport second = upgrade();

            assertThat(second.isNoOp()).isTrue();
            assertThat(second.getAlreadyApplied()).isEqualTo(3);
            assertThat(session.getLedger()).hasSize(3);
            assertThat(session.getCommittedScripts()).hasSize(firstRunScripts.size() + 1); // bootstrap DDL only
            assertThat(strategy.getConnectCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("applies only steps appended after the last run")
        void appendedSteps() {
            upgrade();
            migrations.file("002_extra.sql", "--- 0: Extra table\nCREATE TABLE extra (id INT);\n");

            UpgradeReport report = upgrade();

            assertThat(report.getAppliedSteps()).containsExactly(StepKey.of(2, 0));
            assertThat(session.getLedger()).hasSize(4);
        }

        @Test
        @DisplayName("passes the TLS mode to the strategy")
        void sslMode() {
            upgrade(UpgraderOptions.builder().sslMode(SslMode.REQUIRE).build());

            assertThat(strategy.getLastSslMode()).isEqualTo(SslMode.REQUIRE);
        }

        @Test
        @DisplayName("completes through the reactive channel")
        void reactiveChannel() {
            StepVerifier.create(orchestrator.upgrade(strategy, dir, TARGET, UpgraderOptions.defaults()))
                .assertNext(report -> assertThat(report.getAppliedSteps()).hasSize(3))
                .verifyComplete();
        }

        @Test
        @DisplayName("a failing unlock does not fail a successful run")
        void unlockFailure() {
            session.failOnUnlock();

            assertThat(upgrade().getAppliedSteps()).hasSize(3);
            assertThat(session.isClosed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Schema handling")
    class SchemaHandling {

        @Test
        @DisplayName("creates the schema, activates it and keeps the ledger inside it")
        void createsSchema() {
            migrations.file("002_qualified.sql", "--- 0: Qualified\nCREATE TABLE {{SCHEMA}}.q (id INT);\n");

            upgrade(UpgraderOptions.builder().schema("s").createSchema(true).build());

            assertThat(session.getCalls()).containsSubsequence(
                "LOCK",
                "SCHEMA? s",
                "EXEC CREATE SCHEMA IF NOT EXISTS \"s\"",
                "EXEC SET search_path TO \"s\"",
                "HISTORY");
            assertThat(session.getCalls())
                .anyMatch(call -> call.startsWith("EXEC CREATE TABLE IF NOT EXISTS \"s\".\"$upgraders$\""))
                .contains("EXEC CREATE TABLE s.q (id INT);");
            assertThat(session.getLedger().get(3).getSqlText()).isEqualTo("CREATE TABLE {{SCHEMA}}.q (id INT);");
        }

        @Test
        @DisplayName("uses an existing schema without creating it")
        void existingSchema() {
            session.withSchema("s");

            upgrade(UpgraderOptions.builder().schema("s").build());

            assertThat(session.getCalls()).noneMatch(call -> call.startsWith("EXEC CREATE SCHEMA"));
            assertThat(session.getCalls()).contains("EXEC SET search_path TO \"s\"");
        }

        @Test
        @DisplayName("refuses a missing schema when creation is disabled")
        void missingSchema() {
            assertThatThrownBy(() -> upgrade(UpgraderOptions.builder().schema("s").build()))
                .isInstanceOf(SchemaCreationException.class)
                .hasMessageContaining("'s'");

            assertThat(session.getCalls()).doesNotContain("HISTORY", "BEGIN");
            assertThat(session.getCalls()).endsWith("UNLOCK", "CLOSE");
        }

        @Test
        @DisplayName("skips schema preparation without a schema")
        void noSchema() {
            upgrade();

            assertThat(session.getCalls()).noneMatch(call -> call.startsWith("SCHEMA?"));
            assertThat(session.getCalls()).noneMatch(call -> call.contains("search_path"));
        }
    }

    @Nested
    @DisplayName("Validation failures")
    class ValidationFailures {

        @Test
        @DisplayName("a broken directory fails before connecting")
        void invalidDirectory() {
            migrations.file("003_gap.sql", "--- 0: Gap\nSELECT 1;\n");

            assertThatThrownBy(() -> upgrade())
                .isInstanceOf(FileSequenceException.class);
            assertThat(strategy.getConnectCount()).isZero();
        }

        @Test
        @DisplayName("tampering aborts before any step runs")
        void tamper() {
            session.withLedger(List.of(
                record(0, 0, "Create table", "CREATE TABLE t (id BIGINT);")));

            assertThatThrownBy(() -> upgrade())
                .isInstanceOfSatisfying(TamperDetectedException.class,
                    e -> assertThat(e.getStepKey()).isEqualTo(StepKey.of(0, 0)));

            assertThat(session.getCalls()).doesNotContain("BEGIN");
            assertThat(session.getLedger()).hasSize(1);
            assertThat(session.isClosed()).isTrue();
        }

        @Test
        @DisplayName("a removed file breaks continuity")
        void removedFile() {
            upgrade();
            migrations.delete("001_more.sql");

            assertThatThrownBy(() -> upgrade())
                .isInstanceOf(HistoryContinuityException.class);
            assertThat(session.getLedger()).hasSize(3);
        }

        @Test
        @DisplayName("errors reach the reactive error channel")
        void reactiveError() {
            session.withLedger(List.of(record(5, 0, "Unknown", "SELECT 1;")));

            StepVerifier.create(orchestrator.upgrade(strategy, dir, TARGET, UpgraderOptions.defaults()))
                .expectError(HistoryContinuityException.class)
                .verify();
        }

        @Test
        @DisplayName("a refused connection surfaces as a connection error")
        void refusedConnection() {
            strategy.refuseConnections();

            assertThatThrownBy(() -> upgrade())
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("db:5432/app");
            assertThat(session.getCalls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Step failures")
    class StepFailures {

        @BeforeEach
        void failOnBrokenSql() {
            session.failOnScriptContaining("oops");
        }

        @Test
        @DisplayName("a failing step keeps earlier commits and rolls itself back")
        void midRunFailure() {
            migrations.file("001_more.sql", "--- 0: Broken index\nCREATE INDEX oops ON;\n");

            assertThatThrownBy(() -> upgrade())
                .isInstanceOfSatisfying(SqlExecutionException.class,
                    e -> assertThat(e.getStepKey()).isEqualTo(StepKey.of(1, 0)));

            assertThat(session.getLedger()).extracting(LedgerRecord::getKey)
                .containsExactly(StepKey.of(0, 0), StepKey.of(0, 1));
            assertThat(session.getCommittedScripts()).doesNotContain("CREATE INDEX oops ON;");
            assertThat(session.getCalls()).containsSubsequence(
                "BEGIN", "EXEC CREATE INDEX oops ON;", "ROLLBACK", "UNLOCK", "CLOSE");
            assertThat(session.getCalls()).doesNotContain("INSERT 1:0");
        }

        @Test
        @DisplayName("a failing ledger insert rolls back the step's SQL")
        void ledgerWriteFailure() {
            session.failOnLedgerInsert();

            assertThatThrownBy(() -> upgrade())
                .isInstanceOfSatisfying(LedgerWriteException.class,
                    e -> assertThat(e.getStepKey()).isEqualTo(StepKey.of(0, 0)));

            assertThat(session.getLedger()).isEmpty();
            assertThat(session.getCommittedScripts()).doesNotContain(CREATE_TABLE);
            assertThat(session.getCalls()).containsSubsequence("INSERT 0:0", "ROLLBACK");
        }

        @Test
        @DisplayName("a failing commit is reported for its step")
        void commitFailure() {
            session.failOnCommit();

            assertThatThrownBy(() -> upgrade())
                .isInstanceOf(SqlExecutionException.class)
                .hasMessageContaining("Failed to commit step 0:0");
        }

        @Test
        @DisplayName("a failing rollback is attached to the original error")
        void rollbackFailure() {
            migrations.file("000_init.sql", "--- 0: Broken\nCREATE TABLE oops;\n");
            session.failOnRollback();

            assertThatThrownBy(() -> upgrade())
                .isInstanceOf(SqlExecutionException.class)
                .satisfies(e -> assertThat(e.getSuppressed())
                    .anyMatch(s -> s.getMessage().contains("rollback")));
            assertThat(session.isClosed()).isTrue();
        }
    }
}
