package com.pgschema.upgrader.model;

import com.pgschema.upgrader.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Immutable per-invocation options.
 */
@Value
@Builder(buildMethodName = "buildUnchecked")
public class UpgraderOptions {

    static final String SCHEMA_PLACEHOLDER = "{{SCHEMA}}";

    /**
     * Target schema; null keeps the connection's default search path.
     */
    String schema;

    /**
     * Create {@link #schema} when it does not exist yet.
     */
    boolean createSchema;

    @Builder.Default
    SslMode sslMode = SslMode.DISABLE;

    public static UpgraderOptions defaults() {
        return builder().build();
    }

    public Optional<String> schemaName() {
        return Optional.ofNullable(schema);
    }

    /**
     * Replace every {@value #SCHEMA_PLACEHOLDER} with the schema name.
     * Without a schema the SQL is returned unchanged.
     */
    public String applySchemaSubstitution(String sql) {
        if (schema == null) {
            return sql;
        }
        return sql.replace(SCHEMA_PLACEHOLDER, schema);
    }

    public static class UpgraderOptionsBuilder {

        public UpgraderOptions build() {
            UpgraderOptions options = buildUnchecked();
            if (options.createSchema && options.schema == null) {
                throw new ConfigurationException("create_schema is enabled but no schema name is provided");
            }
            if (options.schema != null && options.schema.isBlank()) {
                throw new ConfigurationException("Schema name cannot be blank");
            }
            if (options.sslMode == null) {
                throw new ConfigurationException("SSL mode cannot be null");
            }
            return options;
        }
    }
}
