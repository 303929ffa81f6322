package com.pgschema.upgrader.session;

import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.infrastructure.database.DatabaseConnectionFactory;
import com.pgschema.upgrader.model.SslMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;

/**
 * JDBC strategy. Every operation runs synchronously on the subscribing thread,
 * so a caller that blocks on the result keeps all database work on its own thread.
 */
@Slf4j
@RequiredArgsConstructor
public class BlockingExecutionStrategy implements ExecutionStrategy {

    private final DatabaseConnectionFactory connectionFactory;

    @Override
    public String getName() {
        return "blocking";
    }

    @Override
    public Mono<DatabaseSession> connect(ConnectionTarget target, SslMode sslMode) {
        return Mono.fromCallable(() -> {
            log.debug("Opening JDBC session to {} (ssl: {})", target.describe(), sslMode);
            return new JdbcDatabaseSession(connectionFactory.createConnection(target, sslMode));
        });
    }

    @Override
    public <T> Mono<T> fromBlocking(Callable<T> work) {
        return Mono.fromCallable(work);
    }
}
