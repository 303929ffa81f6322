package com.pgschema.upgrader.cli;

import com.pgschema.upgrader.SchemaUpgrader;
import com.pgschema.upgrader.config.StrategyType;
import com.pgschema.upgrader.config.UpgraderProperties;
import com.pgschema.upgrader.exception.ConfigurationException;
import com.pgschema.upgrader.exception.MigrationException;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.model.SslMode;
import com.pgschema.upgrader.model.UpgradeReport;
import com.pgschema.upgrader.model.UpgraderOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line surface: {@code upgrade} and {@code check-connection}.
 * Options are given as {@code --name=value} or {@code --name value} and override the {@code upgrader.*} properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UpgraderCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
        "Usage:",
        "  upgrade --path <dir> [connection] [--schema NAME] [--create-schema] [--tls] [--strategy reactive|blocking]",
        "  check-connection [connection] [--tls] [--strategy reactive|blocking]",
        "Connection:",
        "  --connection-string <uri or key=value string>  (default: DATABASE_URL)",
        "  --host H [--port 5432] --user U --database D [--password P]  (password default: PGPASSWORD)",
        "Options also accept the --name=value form.");

    private final SchemaUpgrader schemaUpgrader;
    private final UpgraderProperties properties;
    private final ConnectionTargetResolver connectionTargetResolver;

    private int exitCode = EXIT_SUCCESS;

    @Override
    public void run(ApplicationArguments sourceArgs) {
        ApplicationArguments args = new DefaultApplicationArguments(OptionArguments.normalize(sourceArgs.getSourceArgs()));
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1) {
            log.error("Expected exactly one command, got {}", commands);
            log.info(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        String command = commands.get(0);
        try {
            if ("upgrade".equals(command)) {
                runUpgrade(args);
            } else if ("check-connection".equals(command)) {
                runCheckConnection(args);
            } else {
                log.error("Unknown command: {}", command);
                log.info(USAGE);
                exitCode = EXIT_USAGE;
                return;
            }
            exitCode = EXIT_SUCCESS;

        } catch (ConfigurationException e) {
            log.error("Invalid options: {}", e.getMessage());
            log.info(USAGE);
            exitCode = EXIT_USAGE;

        } catch (MigrationException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runUpgrade(ApplicationArguments args) {
        Path directory = resolvePath(args);
        ConnectionTarget target = connectionTargetResolver.resolve(args);
        UpgraderOptions options = resolveOptions(args);

        UpgradeReport report = resolveStrategy(args) == StrategyType.BLOCKING
            ? schemaUpgrader.upgrade(directory, target, options)
            : schemaUpgrader.upgradeAsync(directory, target, options).block();

        if (report.isNoOp()) {
            log.info("✓ Database is up to date ({} steps already applied)", report.getAlreadyApplied());
        } else {
            log.info("✓ Applied {} steps: {}", report.getAppliedSteps().size(), report.getAppliedSteps());
        }
    }

    private void runCheckConnection(ApplicationArguments args) {
        ConnectionTarget target = connectionTargetResolver.resolve(args);
        SslMode sslMode = resolveSslMode(args);

        if (resolveStrategy(args) == StrategyType.BLOCKING) {
            schemaUpgrader.checkConnection(target, sslMode);
        } else {
            schemaUpgrader.checkConnectionAsync(target, sslMode).block();
        }
    }

    private Path resolvePath(ApplicationArguments args) {
        String path = ConnectionTargetResolver.option(args, "path");
        if (path == null) {
            path = properties.getPath();
        }
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("upgrade needs --path <migration directory>");
        }
        return Path.of(path);
    }

    UpgraderOptions resolveOptions(ApplicationArguments args) {
        String schema = ConnectionTargetResolver.option(args, "schema");
        if (schema == null && properties.getSchema() != null && !properties.getSchema().isBlank()) {
            schema = properties.getSchema();
        }

        return UpgraderOptions.builder()
            .schema(schema)
            .createSchema(args.containsOption("create-schema") || properties.isCreateSchema())
            .sslMode(resolveSslMode(args))
            .build();
    }

    private SslMode resolveSslMode(ApplicationArguments args) {
        return args.containsOption("tls") || properties.isTls() ? SslMode.REQUIRE : SslMode.DISABLE;
    }

    private StrategyType resolveStrategy(ApplicationArguments args) {
        String strategy = ConnectionTargetResolver.option(args, "strategy");
        return strategy == null ? properties.getStrategy() : StrategyType.fromString(strategy);
    }
}
