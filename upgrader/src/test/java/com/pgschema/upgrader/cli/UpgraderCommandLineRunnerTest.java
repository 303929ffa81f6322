package com.pgschema.upgrader.cli;

import com.pgschema.upgrader.SchemaUpgrader;
import com.pgschema.upgrader.config.StrategyType;
import com.pgschema.upgrader.config.UpgraderProperties;
import com.pgschema.upgrader.exception.ConnectionException;
import com.pgschema.upgrader.exception.TamperDetectedException;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.model.SslMode;
import com.pgschema.upgrader.model.StepKey;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("UpgraderCommandLineRunner")
class UpgraderCommandLineRunnerTest {

    private static final String CONNECTION = "--connection-string=postgres://app:pw@db/app";

    private SchemaUpgrader schemaUpgrader;
    private UpgraderProperties properties;
    private UpgraderCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        schemaUpgrader = mock(SchemaUpgrader.class);
        properties = new UpgraderProperties();
        runner = new UpgraderCommandLineRunner(schemaUpgrader, properties, new ConnectionTargetResolver(properties));
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    private static UpgradeReport report(StepKey... applied) {
        return new UpgradeReport("run", 3, 3 - applied.length, List.of(applied));
    }

    @Test
    @DisplayName("upgrade uses the reactive entry point by default")
    void upgradeReactive() {
        when(schemaUpgrader.upgradeAsync(any(), any(), any())).thenReturn(Mono.just(report(StepKey.of(0, 0))));

        assertThat(run("upgrade", "--path=migrations", CONNECTION, "--schema=s", "--create-schema", "--tls"))
            .isEqualTo(UpgraderCommandLineRunner.EXIT_SUCCESS);

        ArgumentCaptor<UpgraderOptions> options = ArgumentCaptor.forClass(UpgraderOptions.class);
        verify(schemaUpgrader).upgradeAsync(eq(Path.of("migrations")), any(ConnectionTarget.class), options.capture());
        assertThat(options.getValue().getSchema()).isEqualTo("s");
        assertThat(options.getValue().isCreateSchema()).isTrue();
        assertThat(options.getValue().getSslMode()).isEqualTo(SslMode.REQUIRE);
    }

    @Test
    @DisplayName("upgrade accepts options with space separated values")
    void upgradeSpaceSeparated() {
        when(schemaUpgrader.upgradeAsync(any(), any(), any())).thenReturn(Mono.just(report()));

        assertThat(run("upgrade", "--path", "migrations", "--connection-string", "postgres://app:pw@db/app",
            "--schema", "s", "--tls"))
            .isEqualTo(UpgraderCommandLineRunner.EXIT_SUCCESS);

        ArgumentCaptor<ConnectionTarget> target = ArgumentCaptor.forClass(ConnectionTarget.class);
        ArgumentCaptor<UpgraderOptions> options = ArgumentCaptor.forClass(UpgraderOptions.class);
        verify(schemaUpgrader).upgradeAsync(eq(Path.of("migrations")), target.capture(), options.capture());
        assertThat(target.getValue().describe()).isEqualTo("db:5432/app");
        assertThat(options.getValue().getSchema()).isEqualTo("s");
        assertThat(options.getValue().getSslMode()).isEqualTo(SslMode.REQUIRE);
    }

    @Test
    @DisplayName("a trailing option without its value is a usage error")
    void trailingOptionWithoutValue() {
        assertThat(run("upgrade", "--connection-string", "postgres://app:pw@db/app", "--path"))
            .isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        verifyNoInteractions(schemaUpgrader);
    }

    @Test
    @DisplayName("upgrade can run on the blocking entry point")
    void upgradeBlocking() {
        when(schemaUpgrader.upgrade(any(), any(), any())).thenReturn(report());

        assertThat(run("upgrade", "--path=migrations", CONNECTION, "--strategy=blocking"))
            .isEqualTo(UpgraderCommandLineRunner.EXIT_SUCCESS);
        verify(schemaUpgrader, never()).upgradeAsync(any(), any(), any());
    }

    @Test
    @DisplayName("falls back to configured path and strategy")
    void configuredDefaults() {
        properties.setPath("db/upgrades");
        properties.setStrategy(StrategyType.BLOCKING);
        when(schemaUpgrader.upgrade(any(), any(), any())).thenReturn(report());

        assertThat(run("upgrade", CONNECTION)).isZero();
        verify(schemaUpgrader).upgrade(eq(Path.of("db/upgrades")), any(), any());
    }

    @Test
    @DisplayName("engine failures exit with 1")
    void engineFailure() {
        when(schemaUpgrader.upgradeAsync(any(), any(), any()))
            .thenReturn(Mono.error(new TamperDetectedException(StepKey.of(0, 0), "Step 0:0 was modified")));

        assertThat(run("upgrade", "--path=migrations", CONNECTION)).isEqualTo(UpgraderCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    @DisplayName("check-connection reports a failed connection with 1")
    void checkConnectionFailure() {
        when(schemaUpgrader.checkConnectionAsync(any(), any()))
            .thenReturn(Mono.error(new ConnectionException("Failed to connect to database: db:5432/app")));

        assertThat(run("check-connection", CONNECTION)).isEqualTo(UpgraderCommandLineRunner.EXIT_FAILURE);
    }

    @Test
    @DisplayName("check-connection succeeds on the blocking entry point")
    void checkConnectionBlocking() {
        assertThat(run("check-connection", CONNECTION, "--strategy=blocking")).isZero();
        verify(schemaUpgrader).checkConnection(any(ConnectionTarget.class), eq(SslMode.DISABLE));
    }

    @Test
    @DisplayName("usage errors exit with 2 without touching the database")
    void usageErrors() {
        assertThat(run()).isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        assertThat(run("downgrade")).isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        assertThat(run("upgrade", CONNECTION)).isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        assertThat(run("upgrade", "--path=m", "--create-schema", CONNECTION)).isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        assertThat(run("upgrade", "--path=m", CONNECTION, "--strategy=parallel")).isEqualTo(UpgraderCommandLineRunner.EXIT_USAGE);
        verifyNoInteractions(schemaUpgrader);
    }
}
