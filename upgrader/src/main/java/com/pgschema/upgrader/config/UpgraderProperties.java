package com.pgschema.upgrader.config;

import com.pgschema.upgrader.ledger.LedgerAccessor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the upgrader application.
 * Command line options override these values.
 */
@ConfigurationProperties(prefix = "upgrader")
@Validated
@Data
public class UpgraderProperties {

    /**
     * Migration directory.
     */
    private String path;

    /**
     * Target schema; empty keeps the default search path.
     */
    private String schema;

    /**
     * Create the target schema when it does not exist.
     */
    private boolean createSchema = false;

    /**
     * Require TLS for the database connection.
     */
    private boolean tls = false;

    @NotNull
    private StrategyType strategy = StrategyType.REACTIVE;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Advisory lock key that serializes concurrent runs.
     */
    private long lockKey = LedgerAccessor.DEFAULT_LOCK_KEY;

    @Valid
    private Connection connection = new Connection();

    @Data
    public static class Connection {
        /**
         * Full connection string; defaults from DATABASE_URL.
         */
        private String connectionString;

        private String host;

        @Min(1)
        @Max(65535)
        private int port = 5432;

        private String user;

        /**
         * Defaults from PGPASSWORD.
         */
        private String password;

        private String database;
    }
}
