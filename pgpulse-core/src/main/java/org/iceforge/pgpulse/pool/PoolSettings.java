package org.iceforge.pgpulse.pool;

import java.time.Duration;

/**
 * Per-database sub-pool limits and connect behavior.
 *
 * @param maxSize           max connections (checked out + idle) per database
 * @param acquireTimeout    how long a caller waits for a saturated sub-pool
 * @param idleTimeout       idle connections older than this are closed; zero disables eviction
 * @param connectAttempts   physical open attempts before giving up
 * @param connectBackoff    first retry delay, doubled per attempt
 * @param maxConnectBackoff cap for the retry delay
 */
public record PoolSettings(
        int maxSize,
        Duration acquireTimeout,
        Duration idleTimeout,
        int connectAttempts,
        Duration connectBackoff,
        Duration maxConnectBackoff
) {
    public PoolSettings {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (connectAttempts <= 0) {
            throw new IllegalArgumentException("connectAttempts must be positive: " + connectAttempts);
        }
        acquireTimeout = acquireTimeout == null ? Duration.ofSeconds(5) : acquireTimeout;
        idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
        connectBackoff = connectBackoff == null ? Duration.ZERO : connectBackoff;
        maxConnectBackoff = maxConnectBackoff == null ? connectBackoff : maxConnectBackoff;
    }

    public static PoolSettings defaults() {
        return new PoolSettings(5, Duration.ofSeconds(5), Duration.ofSeconds(60), 3,
                Duration.ofMillis(500), Duration.ofSeconds(2));
    }

    public PoolSettings withMaxSize(int size) {
        return new PoolSettings(size, acquireTimeout, idleTimeout, connectAttempts, connectBackoff, maxConnectBackoff);
    }

    public PoolSettings withAcquireTimeout(Duration timeout) {
        return new PoolSettings(maxSize, timeout, idleTimeout, connectAttempts, connectBackoff, maxConnectBackoff);
    }

    public PoolSettings withConnectRetry(int attempts, Duration backoff, Duration maxBackoff) {
        return new PoolSettings(maxSize, acquireTimeout, idleTimeout, attempts, backoff, maxBackoff);
    }

    public PoolSettings withIdleTimeout(Duration timeout) {
        return new PoolSettings(maxSize, acquireTimeout, timeout, connectAttempts, connectBackoff, maxConnectBackoff);
    }

    /** Delay before retry number {@code attempt} (0-based): backoff * 2^attempt, capped. */
    Duration backoffFor(int attempt) {
        if (connectBackoff.isZero() || connectBackoff.isNegative()) {
            return Duration.ZERO;
        }
        long millis = connectBackoff.toMillis() << Math.min(attempt, 20);
        return Duration.ofMillis(Math.min(millis, maxConnectBackoff.toMillis()));
    }
}
