package com.pgschema.upgrader.session;

import com.pgschema.upgrader.infrastructure.database.ConnectionTarget;
import com.pgschema.upgrader.model.SslMode;
import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;

/**
 * How database work is scheduled: blocking the calling thread, or suspending
 * on a cooperative scheduler until each I/O operation completes.
 *
 * <p>The upgrade engine is written once against {@link DatabaseSession}; the
 * strategy is chosen by the caller and only decides how sessions are opened
 * and where local blocking work runs.
 */
public interface ExecutionStrategy {

    String getName();

    /**
     * Open a session, negotiating TLS per {@code sslMode}.
     * Fails with {@link com.pgschema.upgrader.exception.ConnectionException}.
     */
    Mono<DatabaseSession> connect(ConnectionTarget target, SslMode sslMode);

    /**
     * Run local blocking work (file system access) in a way that suits this strategy.
     */
    <T> Mono<T> fromBlocking(Callable<T> work);
}
