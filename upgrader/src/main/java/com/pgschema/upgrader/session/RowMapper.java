package com.pgschema.upgrader.session;

/**
 * Maps one result row to a value.
 */
@FunctionalInterface
public interface RowMapper<T> {

    T map(SqlRow row);
}
