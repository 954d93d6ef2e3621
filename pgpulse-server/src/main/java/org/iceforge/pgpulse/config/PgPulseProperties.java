package org.iceforge.pgpulse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Server configuration bound from {@code pgpulse.*}.
 * <p>
 * Credentials in YAML are fine for local dev; deployments should pass them through environment
 * variables ({@code PGPULSE_CONNECTION_PASSWORD}) or a {@code JdbcConnectionProvider} plugin.
 */
@ConfigurationProperties(prefix = "pgpulse")
public class PgPulseProperties {

    private Connection connection = new Connection();
    private Pool pool = new Pool();
    private Query query = new Query();

    public Connection getConnection() {
        return connection;
    }

    public void setConnection(Connection connection) {
        this.connection = connection;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    /** Where the databases live. */
    public static class Connection {

        private String host = "localhost";

        private int port = 5432;

        private String username;

        private String password;

        /** Optional JDBC URL with a {@code {database}} placeholder; overrides host/port. */
        private String jdbcUrlTemplate;

        /** Optional forced JDBC provider id. */
        private String provider;

        /** Used when a request names no database. Defaults to the first entry of {@code databases}. */
        private String defaultDatabase;

        /** Databases requests may target. Empty accepts any name. */
        private List<String> databases = new ArrayList<>();

        /** Extra driver properties (e.g. sslmode, connectTimeout). */
        private Map<String, String> properties = new HashMap<>();

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getJdbcUrlTemplate() {
            return jdbcUrlTemplate;
        }

        public void setJdbcUrlTemplate(String jdbcUrlTemplate) {
            this.jdbcUrlTemplate = jdbcUrlTemplate;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getDefaultDatabase() {
            return defaultDatabase;
        }

        public void setDefaultDatabase(String defaultDatabase) {
            this.defaultDatabase = defaultDatabase;
        }

        public List<String> getDatabases() {
            return databases;
        }

        public void setDatabases(List<String> databases) {
            this.databases = databases;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }
    }

    /** Per-database sub-pool limits. */
    public static class Pool {

        private int maxSize = 5;

        private Duration acquireTimeout = Duration.ofSeconds(5);

        private Duration idleTimeout = Duration.ofSeconds(60);

        private int connectAttempts = 3;

        private Duration connectBackoff = Duration.ofMillis(500);

        private Duration maxConnectBackoff = Duration.ofSeconds(2);

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public int getConnectAttempts() {
            return connectAttempts;
        }

        public void setConnectAttempts(int connectAttempts) {
            this.connectAttempts = connectAttempts;
        }

        public Duration getConnectBackoff() {
            return connectBackoff;
        }

        public void setConnectBackoff(Duration connectBackoff) {
            this.connectBackoff = connectBackoff;
        }

        public Duration getMaxConnectBackoff() {
            return maxConnectBackoff;
        }

        public void setMaxConnectBackoff(Duration maxConnectBackoff) {
            this.maxConnectBackoff = maxConnectBackoff;
        }
    }

    public static class Query {

        /** Default statement timeout; unset means none. */
        private Duration statementTimeout;

        private boolean collectPlanStats = true;

        /** Cap on rows materialized per result, 0 for unlimited. */
        private int maxRows = 10_000;

        /** Threads used for submitted (cancellable) queries. */
        private int workerThreads = 4;

        public Duration getStatementTimeout() {
            return statementTimeout;
        }

        public void setStatementTimeout(Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
        }

        public boolean isCollectPlanStats() {
            return collectPlanStats;
        }

        public void setCollectPlanStats(boolean collectPlanStats) {
            this.collectPlanStats = collectPlanStats;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }
}
