package com.pgschema.upgrader.session;

import com.pgschema.upgrader.exception.DatabaseOperationException;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DatabaseSession} over a JDBC connection.
 */
@RequiredArgsConstructor
class JdbcDatabaseSession implements DatabaseSession {

    private final Connection connection;

    @Override
    public Mono<Void> beginTransaction() {
        return run("begin transaction", () -> connection.setAutoCommit(false));
    }

    @Override
    public Mono<Void> executeScript(String sql) {
        return run("execute script", () -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(sql);
            }
        });
    }

    @Override
    public Mono<Long> update(String sql, Object... params) {
        return call("update", () -> {
            try (PreparedStatement stmt = prepare(sql, params)) {
                return stmt.executeLargeUpdate();
            }
        });
    }

    @Override
    public <T> Flux<T> query(String sql, RowMapper<T> mapper, Object... params) {
        return call("query", () -> {
            List<T> rows = new ArrayList<>();
            try (PreparedStatement stmt = prepare(sql, params);
                ResultSet rs = stmt.executeQuery()) {

                SqlRow row = new ResultSetRow(rs);
                while (rs.next()) {
                    rows.add(mapper.map(row));
                }
            }
            return rows;
        }).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Void> commit() {
        return run("commit", () -> {
            if (!connection.getAutoCommit()) {
                connection.commit();
                connection.setAutoCommit(true);
            }
        });
    }

    @Override
    public Mono<Void> rollback() {
        return run("rollback", () -> {
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
        });
    }

    @Override
    public Mono<Void> close() {
        return run("close", connection::close);
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private static Mono<Void> run(String operation, SqlAction action) {
        return Mono.fromRunnable(() -> {
            try {
                action.run();
            } catch (SQLException e) {
                throw translate(operation, e);
            }
        });
    }

    private static <T> Mono<T> call(String operation, SqlCall<T> call) {
        return Mono.fromCallable(() -> {
            try {
                return call.call();
            } catch (SQLException e) {
                throw translate(operation, e);
            }
        });
    }

    private static DatabaseOperationException translate(String operation, SQLException e) {
        return new DatabaseOperationException(
            "JDBC " + operation + " failed: " + e.getMessage(), e.getSQLState(), e);
    }

    @FunctionalInterface
    private interface SqlAction {
        void run() throws SQLException;
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }

    @RequiredArgsConstructor
    private static final class ResultSetRow implements SqlRow {

        private final ResultSet rs;

        @Override
        public int getInt(String column) {
            try {
                return rs.getInt(column);
            } catch (SQLException e) {
                throw translate("read column " + column, e);
            }
        }

        @Override
        public String getString(String column) {
            try {
                return rs.getString(column);
            } catch (SQLException e) {
                throw translate("read column " + column, e);
            }
        }

        @Override
        public OffsetDateTime getTimestamp(String column) {
            try {
                return rs.getObject(column, OffsetDateTime.class);
            } catch (SQLException e) {
                throw translate("read column " + column, e);
            }
        }
    }
}
