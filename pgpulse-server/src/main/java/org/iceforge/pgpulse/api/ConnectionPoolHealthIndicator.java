package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.query.QueryExecutor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;

/** UP when every database with a live sub-pool answers {@code SELECT 1}. */
@Component
public class ConnectionPoolHealthIndicator implements HealthIndicator {

    private final QueryExecutor executor;

    public ConnectionPoolHealthIndicator(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public Health health() {
        if (executor.pool().isClosed()) {
            return Health.outOfService().withDetail("reason", "pool closed").build();
        }
        Map<String, Boolean> databases = executor.healthCheck();
        boolean allUp = databases.values().stream().allMatch(Boolean::booleanValue);
        Health.Builder b = allUp ? Health.up() : Health.down();
        return b.withDetail("databases", databases)
                .withDetail("acquired", executor.pool().acquireCount())
                .withDetail("released", executor.pool().releaseCount())
                .build();
    }
}
