package org.iceforge.pgpulse.config;

import org.iceforge.pgpulse.jdbc.ConnectionConfigProvider;
import org.iceforge.pgpulse.jdbc.StaticConnectionConfigProvider;
import org.iceforge.pgpulse.jdbc.spi.JdbcClientFactory;
import org.iceforge.pgpulse.jdbc.spi.JdbcConnectionProvider;
import org.iceforge.pgpulse.pool.ConnectionPool;
import org.iceforge.pgpulse.pool.PoolSettings;
import org.iceforge.pgpulse.query.QueryExecutor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PgPulseConfig {

    @Bean
    @ConditionalOnMissingBean(ConnectionConfigProvider.class)
    public ConnectionConfigProvider connectionConfigProvider(PgPulseProperties props) {
        PgPulseProperties.Connection c = props.getConnection();
        return StaticConnectionConfigProvider.builder()
                .host(c.getHost())
                .port(c.getPort())
                .credentials(c.getUsername(), c.getPassword())
                .jdbcUrlTemplate(c.getJdbcUrlTemplate())
                .provider(c.getProvider())
                .defaultDatabase(c.getDefaultDatabase())
                .knownDatabases(c.getDatabases())
                .properties(c.getProperties())
                .build();
    }

    /** Spring-managed {@link JdbcConnectionProvider} beans plus ServiceLoader plugins. */
    @Bean
    public JdbcClientFactory jdbcClientFactory(ObjectProvider<JdbcConnectionProvider> providers) {
        return new JdbcClientFactory(providers.orderedStream().toList());
    }

    @Bean(destroyMethod = "closeAll")
    public ConnectionPool connectionPool(ConnectionConfigProvider configProvider,
                                         JdbcClientFactory clientFactory,
                                         PgPulseProperties props) {
        PgPulseProperties.Pool p = props.getPool();
        PoolSettings settings = new PoolSettings(p.getMaxSize(), p.getAcquireTimeout(), p.getIdleTimeout(),
                p.getConnectAttempts(), p.getConnectBackoff(), p.getMaxConnectBackoff());
        return new ConnectionPool(configProvider, clientFactory, settings);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pgpulseQueryWorkers(PgPulseProperties props) {
        int threads = Math.max(1, props.getQuery().getWorkerThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "pgpulse-query");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "cleanup")
    public QueryExecutor queryExecutor(ConnectionPool pool, ExecutorService pgpulseQueryWorkers, PgPulseProperties props) {
        PgPulseProperties.Query q = props.getQuery();
        QueryExecutor.Options options = new QueryExecutor.Options(q.getStatementTimeout(), q.isCollectPlanStats(), q.getMaxRows());
        return new QueryExecutor(pool, options, pgpulseQueryWorkers);
    }
}
