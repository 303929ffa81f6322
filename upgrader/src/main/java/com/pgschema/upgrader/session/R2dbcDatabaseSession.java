package com.pgschema.upgrader.session;

import com.pgschema.upgrader.exception.DatabaseOperationException;
import com.pgschema.upgrader.exception.MigrationException;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.Statement;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.function.Function;

/**
 * {@link DatabaseSession} over an R2DBC connection.
 */
@RequiredArgsConstructor
class R2dbcDatabaseSession implements DatabaseSession {

    private final Connection connection;

    /**
     * Open transaction flag; touched only from the session's single sequential flow.
     */
    private volatile boolean inTransaction;

    @Override
    public Mono<Void> beginTransaction() {
        return Mono.defer(() -> Mono.from(connection.beginTransaction()))
            .doOnSuccess(ignored -> inTransaction = true)
            .onErrorMap(translate("begin transaction"));
    }

    @Override
    public Mono<Void> executeScript(String sql) {
        return Flux.defer(() -> execute(connection.createStatement(sql)))
            .concatMap(Result::getRowsUpdated)
            .then()
            .onErrorMap(translate("execute script"));
    }

    @Override
    public Mono<Long> update(String sql, Object... params) {
        return Flux.defer(() -> execute(bind(connection.createStatement(toNativePlaceholders(sql)), params)))
            .concatMap(Result::getRowsUpdated)
            .reduce(0L, Long::sum)
            .onErrorMap(translate("update"));
    }

    @Override
    public <T> Flux<T> query(String sql, RowMapper<T> mapper, Object... params) {
        return Flux.defer(() -> execute(bind(connection.createStatement(toNativePlaceholders(sql)), params)))
            .concatMap(result -> result.map((row, metadata) -> mapper.map(new R2dbcRow(row))))
            .onErrorMap(translate("query"));
    }

    @Override
    public Mono<Void> commit() {
        return Mono.defer(() -> Mono.from(connection.commitTransaction()))
            .doOnSuccess(ignored -> inTransaction = false)
            .onErrorMap(translate("commit"));
    }

    @Override
    public Mono<Void> rollback() {
        return Mono.defer(() -> inTransaction
                ? Mono.from(connection.rollbackTransaction())
                : Mono.<Void>empty())
            .doOnSuccess(ignored -> inTransaction = false)
            .onErrorMap(translate("rollback"));
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> Mono.from(connection.close())).onErrorMap(translate("close"));
    }

    private static Flux<Result> execute(Statement statement) {
        return Flux.from(statement.execute());
    }

    private static Statement bind(Statement statement, Object... params) {
        for (int i = 0; i < params.length; i++) {
            if (params[i] == null) {
                statement.bindNull(i, String.class);
            } else {
                statement.bind(i, params[i]);
            }
        }
        return statement;
    }

    /**
     * Rewrite {@code ?} placeholders to PostgreSQL's {@code $n}. Quoted literals are left alone.
     */
    static String toNativePlaceholders(String sql) {
        StringBuilder out = new StringBuilder(sql.length() + 8);
        boolean inLiteral = false;
        int index = 0;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
                out.append(c);
            } else if (c == '?' && !inLiteral) {
                out.append('$').append(++index);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static Function<Throwable, Throwable> translate(String operation) {
        return e -> {
            if (e instanceof MigrationException) {
                return e;
            }
            String sqlState = e instanceof R2dbcException ? ((R2dbcException) e).getSqlState() : null;
            return new DatabaseOperationException("R2DBC " + operation + " failed: " + e.getMessage(), sqlState, e);
        };
    }

    @RequiredArgsConstructor
    private static final class R2dbcRow implements SqlRow {

        private final Row row;

        @Override
        public int getInt(String column) {
            Integer value = row.get(column, Integer.class);
            if (value == null) {
                throw new DatabaseOperationException("Column " + column + " is null", null, null);
            }
            return value;
        }

        @Override
        public String getString(String column) {
            return row.get(column, String.class);
        }

        @Override
        public OffsetDateTime getTimestamp(String column) {
            return row.get(column, OffsetDateTime.class);
        }
    }
}
