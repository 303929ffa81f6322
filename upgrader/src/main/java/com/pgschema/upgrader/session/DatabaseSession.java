package com.pgschema.upgrader.session;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One exclusively owned database connection, as seen by the upgrade engine.
 *
 * <p>Every operation is lazy: nothing reaches the database until the returned
 * publisher is subscribed. Failures surface as
 * {@link com.pgschema.upgrader.exception.DatabaseOperationException} whatever the driver.
 * Parameterized statements use JDBC style {@code ?} placeholders.
 */
public interface DatabaseSession {

    /**
     * Leave auto-commit mode; statements run inside one transaction until commit or rollback.
     */
    Mono<Void> beginTransaction();

    /**
     * Run SQL text verbatim. The text may hold several statements.
     */
    Mono<Void> executeScript(String sql);

    /**
     * Run a single parameterized statement and return the affected row count.
     */
    Mono<Long> update(String sql, Object... params);

    /**
     * Run a single parameterized query and map every row.
     */
    <T> Flux<T> query(String sql, RowMapper<T> mapper, Object... params);

    Mono<Void> commit();

    /**
     * Roll back the open transaction. Does nothing outside a transaction.
     */
    Mono<Void> rollback();

    Mono<Void> close();
}
