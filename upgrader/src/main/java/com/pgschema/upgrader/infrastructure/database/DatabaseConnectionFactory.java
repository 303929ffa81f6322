package com.pgschema.upgrader.infrastructure.database;

import com.pgschema.upgrader.exception.ConnectionException;
import com.pgschema.upgrader.model.SslMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

/**
 * Factory for JDBC connections to PostgreSQL with proper URL building and TLS settings.
 */
@Slf4j
@RequiredArgsConstructor
public class DatabaseConnectionFactory {

    private static final String DRIVER_CLASS_NAME = "org.postgresql.Driver";
    private static final String APPLICATION_NAME = "pg-schema-upgrader";

    private final Duration connectTimeout;

    /**
     * Create a database connection for the target.
     */
    public Connection createConnection(ConnectionTarget target, SslMode sslMode) {
        try {
            // Load driver class
            Class.forName(DRIVER_CLASS_NAME);

            String jdbcUrl = buildJdbcUrl(target);
            log.debug("Creating connection to: {}", jdbcUrl);

            return DriverManager.getConnection(jdbcUrl, buildProperties(target, sslMode));

        } catch (ClassNotFoundException e) {
            throw new ConnectionException("Database driver not found: " + DRIVER_CLASS_NAME, e);
        } catch (SQLException e) {
            throw new ConnectionException(
                "Failed to connect to database: " + target.describe() + ": " + e.getMessage(),
                e
            );
        }
    }

    /**
     * Build the JDBC URL. Credentials and TLS settings travel as connection properties.
     */
    public String buildJdbcUrl(ConnectionTarget target) {
        return String.format(
            "jdbc:postgresql://%s:%d/%s",
            target.getHost(),
            target.getPort(),
            target.getDatabase()
        );
    }

    Properties buildProperties(ConnectionTarget target, SslMode sslMode) {
        Properties props = new Properties();
        if (target.getUser() != null) {
            props.setProperty("user", target.getUser());
        }
        if (target.getPassword() != null) {
            props.setProperty("password", target.getPassword());
        }
        props.setProperty("sslmode", sslMode == SslMode.REQUIRE ? "require" : "disable");
        props.setProperty("connectTimeout", String.valueOf(Math.max(1, connectTimeout.toSeconds())));
        props.setProperty("ApplicationName", APPLICATION_NAME);
        return props;
    }
}
