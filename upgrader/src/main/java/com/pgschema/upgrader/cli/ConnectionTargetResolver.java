package com.pgschema.upgrader.cli;

import com.pgschema.upgrader.config.UpgraderProperties;
import com.pgschema.upgrader.exception.ConfigurationException;
import com.pgschema.upgrader.infrastructure.database.ConnectionStringParser;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles the connection target from command line options and configured defaults.
 *
 * <p>Precedence: an explicit {@code --connection-string}, then explicit discrete options,
 * then the configured connection string ({@code DATABASE_URL}), then configured discrete values.
 * The password falls back to the configured one ({@code PGPASSWORD}) when none is given.
 */
@Component
@RequiredArgsConstructor
public class ConnectionTargetResolver {

    static final String CONNECTION_STRING = "connection-string";
    static final List<String> DISCRETE_OPTIONS = List.of("host", "port", "user", "password", "database");

    private final UpgraderProperties properties;

    public ConnectionTarget resolve(ApplicationArguments args) {
        UpgraderProperties.Connection configured = properties.getConnection();
        String explicitConnectionString = option(args, CONNECTION_STRING);
        boolean hasDiscrete = DISCRETE_OPTIONS.stream().anyMatch(args::containsOption);

        if (explicitConnectionString != null && hasDiscrete) {
            throw new ConfigurationException(
                "Use either --connection-string or discrete connection options (--host, --user, ...), not both");
        }
        if (explicitConnectionString != null) {
            return withPasswordFallback(ConnectionStringParser.parse(explicitConnectionString), configured);
        }
        if (hasDiscrete) {
            return fromDiscrete(args, configured);
        }
        if (hasText(configured.getConnectionString())) {
            return withPasswordFallback(ConnectionStringParser.parse(configured.getConnectionString()), configured);
        }
        if (hasText(configured.getHost())) {
            return fromDiscrete(args, configured);
        }
        throw new ConfigurationException(
            "No database connection given: pass --connection-string or --host/--user/--database, or set DATABASE_URL");
    }

    private ConnectionTarget fromDiscrete(ApplicationArguments args, UpgraderProperties.Connection configured) {
        String host = firstNonBlank(option(args, "host"), configured.getHost());
        String user = firstNonBlank(option(args, "user"), configured.getUser());
        String database = firstNonBlank(option(args, "database"), configured.getDatabase());

        if (host == null || user == null || database == null) {
            throw new ConfigurationException("Discrete connection options need --host, --user and --database");
        }

        int port = configured.getPort();
        String explicitPort = option(args, "port");
        if (explicitPort != null) {
            try {
                port = Integer.parseInt(explicitPort);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid port: " + explicitPort, e);
            }
        }

        return ConnectionTarget.builder()
            .host(host)
            .port(port)
            .user(user)
            .database(database)
            .password(firstNonBlank(option(args, "password"), configured.getPassword()))
            .build();
    }

    private static ConnectionTarget withPasswordFallback(ConnectionTarget target, UpgraderProperties.Connection configured) {
        if (target.getPassword() == null && hasText(configured.getPassword())) {
            return target.toBuilder().password(configured.getPassword()).build();
        }
        return target;
    }

    static String option(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || !hasText(values.get(values.size() - 1))) {
            throw new ConfigurationException("Option --" + name + " needs a value (--" + name + "=...)");
        }
        return values.get(values.size() - 1);
    }

    private static String firstNonBlank(String first, String second) {
        if (hasText(first)) {
            return first;
        }
        return hasText(second) ? second : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
