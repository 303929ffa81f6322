package com.pgschema.upgrader.config;

import com.pgschema.upgrader.infrastructure.database.DatabaseConnectionFactory;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.session.BlockingExecutionStrategy;
import com.pgschema.upgrader.session.ReactiveExecutionStrategy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for database-related beans.
 */
@Configuration
@EnableConfigurationProperties(UpgraderProperties.class)
public class UpgraderConfiguration {

    @Bean
    public DatabaseConnectionFactory databaseConnectionFactory(UpgraderProperties properties) {
        return new DatabaseConnectionFactory(properties.getConnectTimeout());
    }

    @Bean
    public BlockingExecutionStrategy blockingExecutionStrategy(DatabaseConnectionFactory connectionFactory) {
        return new BlockingExecutionStrategy(connectionFactory);
    }

    @Bean
    public ReactiveExecutionStrategy reactiveExecutionStrategy(UpgraderProperties properties) {
        return new ReactiveExecutionStrategy(properties.getConnectTimeout());
    }

    /**
     * Ledger access with the configured advisory lock key.
     */
    @Bean
    public LedgerAccessor ledgerAccessor(UpgraderProperties properties) {
        return new LedgerAccessor(properties.getLockKey());
    }
}
