package org.iceforge.pgpulse.jdbc;

import java.util.Map;
import java.util.Objects;

/**
 * Physical connection parameters for one target database.
 * <p>
 * Produced by a {@link ConnectionConfigProvider} per acquisition. {@code jdbcUrl} is optional; when
 * blank, providers build a PostgreSQL URL from host/port/database.
 */
public record ConnectionSettings(
        String host,
        int port,
        String database,
        String username,
        String password,
        String jdbcUrl,
        String provider,
        Map<String, String> properties,
        Map<String, String> tags
) {
    public static final int DEFAULT_PORT = 5432;

    public ConnectionSettings {
        Objects.requireNonNull(database, "database");
        if (database.isBlank()) {
            throw new IllegalArgumentException("database must not be blank");
        }
        port = port <= 0 ? DEFAULT_PORT : port;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /** URL for this database: the explicit {@code jdbcUrl} or {@code jdbc:postgresql://host:port/database}. */
    public String effectiveJdbcUrl() {
        if (jdbcUrl != null && !jdbcUrl.isBlank()) {
            return jdbcUrl;
        }
        String h = (host == null || host.isBlank()) ? "localhost" : host;
        return "jdbc:postgresql://" + h + ":" + port + "/" + database;
    }

    /** Safe to log: no credentials. */
    public String describe() {
        return "database=" + database + ", url=" + redactUrl(effectiveJdbcUrl());
    }

    private static String redactUrl(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }
}
