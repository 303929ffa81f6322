package com.pgschema.upgrader.infrastructure.database;

import com.pgschema.upgrader.exception.ConfigurationException;
import org.postgresql.Driver;
import org.postgresql.PGProperty;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Parses PostgreSQL connection strings into a {@link ConnectionTarget}.
 *
 * <p>Accepted forms: {@code postgres://} and {@code postgresql://} URIs,
 * {@code jdbc:postgresql:} URLs (read by the pgjdbc driver itself), and libpq keyword strings such as
 * {@code host='db' port=5432 user='app' password='s3cret' dbname='app'}.
 * Query parameters other than {@code user} and {@code password} are ignored;
 * TLS is governed by the upgrader options.
 */
public final class ConnectionStringParser {

    private ConnectionStringParser() {
        // Utility class - prevent instantiation
    }

    public static ConnectionTarget parse(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new ConfigurationException("Connection string cannot be empty");
        }
        String value = connectionString.strip();

        if (value.startsWith("jdbc:postgresql:")) {
            return parseJdbcUrl(value);
        }
        if (value.startsWith("postgres://") || value.startsWith("postgresql://")) {
            return parseUri(value);
        }
        return parseKeywords(value);
    }

    private static ConnectionTarget parseJdbcUrl(String url) {
        Properties props = Driver.parseURL(url, new Properties());
        if (props == null) {
            throw new ConfigurationException("Invalid JDBC URL: " + url);
        }

        // Multi-host URLs come back comma separated; the first host is the target.
        String host = first(PGProperty.PG_HOST.getOrDefault(props));
        String port = first(PGProperty.PG_PORT.getOrDefault(props));
        if (host == null || host.isEmpty()) {
            throw new ConfigurationException("JDBC URL has no host");
        }

        ConnectionTarget.ConnectionTargetBuilder builder = ConnectionTarget.builder()
            .host(host)
            .database(PGProperty.PG_DBNAME.getOrDefault(props))
            .user(PGProperty.USER.getOrDefault(props))
            .password(PGProperty.PASSWORD.getOrDefault(props));
        if (port != null && !port.isEmpty()) {
            try {
                builder.port(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid port: " + port, e);
            }
        }
        return builder.build();
    }

    private static String first(String commaSeparated) {
        if (commaSeparated == null) {
            return null;
        }
        int comma = commaSeparated.indexOf(',');
        return comma < 0 ? commaSeparated : commaSeparated.substring(0, comma);
    }

    private static ConnectionTarget parseUri(String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid connection URI: " + e.getMessage(), e);
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException("Connection URI has no host");
        }

        ConnectionTarget.ConnectionTargetBuilder builder = ConnectionTarget.builder().host(uri.getHost());
        if (uri.getPort() > 0) {
            builder.port(uri.getPort());
        }

        String path = uri.getRawPath();
        if (path != null && path.length() > 1) {
            builder.database(decode(path.substring(1)));
        }

        String userInfo = uri.getRawUserInfo();
        if (userInfo != null) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                builder.user(decode(userInfo));
            } else {
                builder.user(decode(userInfo.substring(0, colon)));
                builder.password(decode(userInfo.substring(colon + 1)));
            }
        }

        Map<String, String> query = parseQuery(uri.getRawQuery());
        if (query.containsKey("user")) {
            builder.user(query.get("user"));
        }
        if (query.containsKey("password")) {
            builder.password(query.get("password"));
        }
        return builder.build();
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return params;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    /**
     * libpq keyword/value format. Values may be single-quoted with backslash escapes.
     */
    private static ConnectionTarget parseKeywords(String value) {
        Map<String, String> pairs = new HashMap<>();
        int i = 0;
        int length = value.length();

        while (i < length) {
            while (i < length && Character.isWhitespace(value.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }

            int eq = value.indexOf('=', i);
            if (eq < 0) {
                throw new ConfigurationException("Invalid connection string near: " + value.substring(i));
            }
            String key = value.substring(i, eq).strip();
            i = eq + 1;
            while (i < length && Character.isWhitespace(value.charAt(i))) {
                i++;
            }

            StringBuilder val = new StringBuilder();
            if (i < length && value.charAt(i) == '\'') {
                i++;
                boolean closed = false;
                while (i < length) {
                    char c = value.charAt(i++);
                    if (c == '\\' && i < length) {
                        val.append(value.charAt(i++));
                    } else if (c == '\'') {
                        closed = true;
                        break;
                    } else {
                        val.append(c);
                    }
                }
                if (!closed) {
                    throw new ConfigurationException("Unterminated quoted value for key: " + key);
                }
            } else {
                while (i < length && !Character.isWhitespace(value.charAt(i))) {
                    val.append(value.charAt(i++));
                }
            }
            pairs.put(key, val.toString());
        }

        if (!pairs.containsKey("host")) {
            throw new ConfigurationException("Connection string has no host");
        }

        ConnectionTarget.ConnectionTargetBuilder builder = ConnectionTarget.builder()
            .host(pairs.get("host"))
            .user(pairs.get("user"))
            .password(pairs.get("password"))
            .database(pairs.getOrDefault("dbname", pairs.get("user")));

        if (pairs.containsKey("port")) {
            try {
                builder.port(Integer.parseInt(pairs.get("port")));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid port: " + pairs.get("port"), e);
            }
        }
        return builder.build();
    }
}
