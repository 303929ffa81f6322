package com.pgschema.upgrader.session;

import com.pgschema.upgrader.exception.ConnectionException;
import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.model.SslMode;
import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import io.r2dbc.postgresql.client.SSLMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * R2DBC strategy. Each operation is a non-blocking suspension point; the driver's
 * event loop resumes the flow when the server answers.
 */
@Slf4j
@RequiredArgsConstructor
public class ReactiveExecutionStrategy implements ExecutionStrategy {

    private final Duration connectTimeout;

    @Override
    public String getName() {
        return "reactive";
    }

    @Override
    public Mono<DatabaseSession> connect(ConnectionTarget target, SslMode sslMode) {
        return Mono.defer(() -> {
            log.debug("Opening R2DBC session to {} (ssl: {})", target.describe(), sslMode);
            PostgresqlConnectionFactory factory = new PostgresqlConnectionFactory(configuration(target, sslMode));
            return factory.create();
        })
            .<DatabaseSession>map(R2dbcDatabaseSession::new)
            .onErrorMap(e -> !(e instanceof ConnectionException),
                e -> new ConnectionException(
                    "Failed to connect to database: " + target.describe() + ": " + e.getMessage(), e));
    }

    @Override
    public <T> Mono<T> fromBlocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    private PostgresqlConnectionConfiguration configuration(ConnectionTarget target, SslMode sslMode) {
        PostgresqlConnectionConfiguration.Builder builder = PostgresqlConnectionConfiguration.builder()
            .host(target.getHost())
            .port(target.getPort())
            .database(target.getDatabase())
            .username(target.getUser())
            .connectTimeout(connectTimeout)
            .sslMode(sslMode == SslMode.REQUIRE ? SSLMode.REQUIRE : SSLMode.DISABLE);

        if (target.getPassword() != null) {
            builder.password(target.getPassword());
        }
        return builder.build();
    }
}
