package com.pgschema.upgrader.model;

/**
 * TLS policy applied when connecting.
 */
public enum SslMode {

    /**
     * Never attempt TLS.
     */
    DISABLE,

    /**
     * Fail the connect step if TLS cannot be negotiated.
     */
    REQUIRE
}
