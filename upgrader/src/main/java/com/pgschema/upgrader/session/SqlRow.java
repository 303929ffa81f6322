package com.pgschema.upgrader.session;

import java.time.OffsetDateTime;

/**
 * Driver-neutral read access to the current result row.
 */
public interface SqlRow {

    int getInt(String column);

    String getString(String column);

    OffsetDateTime getTimestamp(String column);
}
