package org.iceforge.pgpulse.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed host and credentials shared by a set of databases on one server.
 * <p>
 * When {@code knownDatabases} is non-empty, a request for a database outside that list falls back
 * to the first known database. An empty list accepts any database name.
 * <p>
 * {@code jdbcUrlTemplate} may contain a {@code {database}} placeholder
 * (e.g. {@code jdbc:postgresql://db:5432/{database}?sslmode=require}).
 */
public final class StaticConnectionConfigProvider implements ConnectionConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(StaticConnectionConfigProvider.class);

    public static final String DATABASE_PLACEHOLDER = "{database}";

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String jdbcUrlTemplate;
    private final String provider;
    private final String defaultDatabase;
    private final List<String> knownDatabases;
    private final Map<String, String> properties;

    private StaticConnectionConfigProvider(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.username = b.username;
        this.password = b.password;
        this.jdbcUrlTemplate = b.jdbcUrlTemplate;
        this.provider = b.provider;
        this.knownDatabases = List.copyOf(b.knownDatabases);
        this.properties = Map.copyOf(b.properties);

        String def = b.defaultDatabase;
        if (def == null || def.isBlank()) {
            if (knownDatabases.isEmpty()) {
                throw new IllegalArgumentException("defaultDatabase is required when no databases are listed");
            }
            def = knownDatabases.get(0);
        }
        this.defaultDatabase = def;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String defaultDatabase() {
        return defaultDatabase;
    }

    @Override
    public ConnectionSettings resolve(String database) {
        String requested = (database == null || database.isBlank()) ? defaultDatabase : database;
        String effective = requested;
        if (!knownDatabases.isEmpty() && !knownDatabases.contains(requested)) {
            effective = knownDatabases.get(0);
            log.debug("Database '{}' is not configured, using '{}'", requested, effective);
        }

        String url = null;
        if (jdbcUrlTemplate != null && !jdbcUrlTemplate.isBlank()) {
            url = jdbcUrlTemplate.replace(DATABASE_PLACEHOLDER, effective);
        }
        return new ConnectionSettings(host, port, effective, username, password, url, provider, properties, Map.of());
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = ConnectionSettings.DEFAULT_PORT;
        private String username;
        private String password;
        private String jdbcUrlTemplate;
        private String provider;
        private String defaultDatabase;
        private List<String> knownDatabases = List.of();
        private final Map<String, String> properties = new LinkedHashMap<>();

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder jdbcUrlTemplate(String jdbcUrlTemplate) {
            this.jdbcUrlTemplate = jdbcUrlTemplate;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder defaultDatabase(String defaultDatabase) {
            this.defaultDatabase = defaultDatabase;
            return this;
        }

        public Builder knownDatabases(List<String> knownDatabases) {
            this.knownDatabases = Objects.requireNonNullElse(knownDatabases, List.of());
            return this;
        }

        public Builder property(String key, String value) {
            if (key != null && value != null) {
                this.properties.put(key, value);
            }
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            if (properties != null) {
                properties.forEach(this::property);
            }
            return this;
        }

        public StaticConnectionConfigProvider build() {
            return new StaticConnectionConfigProvider(this);
        }
    }
}
