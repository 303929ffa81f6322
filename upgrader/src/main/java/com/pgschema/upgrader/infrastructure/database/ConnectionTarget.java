package com.pgschema.upgrader.infrastructure.database;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Where to connect: host, port, database and credentials.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionTarget {

    public static final int DEFAULT_PORT = 5432;

    String host;

    @Builder.Default
    int port = DEFAULT_PORT;

    String database;
    String user;

    @ToString.Exclude
    String password;

    /**
     * Log-safe description, without credentials.
     */
    public String describe() {
        return host + ":" + port + "/" + database;
    }
}
