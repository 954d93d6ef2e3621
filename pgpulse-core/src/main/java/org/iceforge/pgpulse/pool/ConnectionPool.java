package org.iceforge.pgpulse.pool;

import org.iceforge.pgpulse.jdbc.ConnectionConfigProvider;
import org.iceforge.pgpulse.jdbc.ConnectionSettings;
import org.iceforge.pgpulse.jdbc.spi.JdbcClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Connection pool with one independent sub-pool per target database.
 * <p>
 * Connections are opened lazily on first demand, at most {@link PoolSettings#maxSize()} per
 * database. When a database's sub-pool is saturated, callers wait in FIFO order and a released
 * connection goes straight to the longest waiter for that same database. A connection bound to one
 * database is never handed to a request for another.
 * <p>
 * Example usage:
 * <pre>
 *   ConnectionPool pool = new ConnectionPool(configProvider, JdbcClientFactory.withDefaults(), PoolSettings.defaults());
 *   try (ManagedConnection mc = pool.acquire("orders")) {
 *       // use mc.connection()
 *   }
 *   pool.closeAll();
 * </pre>
 */
public final class ConnectionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionConfigProvider configProvider;
    private final JdbcClientFactory clientFactory;
    private final PoolSettings settings;
    private final ConcurrentHashMap<String, SubPool> subPools = new ConcurrentHashMap<>();
    private final LongAdder acquired = new LongAdder();
    private final LongAdder released = new LongAdder();
    private final ScheduledExecutorService reaper;
    private volatile boolean closed;

    public ConnectionPool(ConnectionConfigProvider configProvider, JdbcClientFactory clientFactory, PoolSettings settings) {
        this.configProvider = Objects.requireNonNull(configProvider, "configProvider");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.reaper = startReaper(settings.idleTimeout());
    }

    /**
     * Lease a connection for {@code database}, or for the provider's default database when
     * {@code null}/blank.
     *
     * @throws ConnectionException if the physical open fails after its retry budget, the wait for a
     *                             saturated sub-pool times out, or the pool is closed
     */
    public ManagedConnection acquire(String database) {
        ensureOpen();
        ConnectionSettings resolved = configProvider.resolve(database);
        String key = resolved.database();

        while (true) {
            ensureOpen();
            SubPool sub = subPools.computeIfAbsent(key, this::newSubPool);
            if (closed) {
                subPools.remove(key, sub);
                sub.close();
                throw new ConnectionException("Connection pool is closed");
            }
            if (sub.isClosed()) {
                // closePool() raced with us; start a fresh sub-pool.
                subPools.remove(key, sub);
                continue;
            }
            return sub.acquire(() -> open(resolved), settings.acquireTimeout());
        }
    }

    /** Same as {@link ManagedConnection#release()}; tolerates {@code null} and repeated calls. */
    public void release(ManagedConnection conn) {
        if (conn != null) {
            conn.release();
        }
    }

    /** Close one database's sub-pool. A later acquire for it starts a new one. */
    public void closePool(String database) {
        SubPool sub = database == null ? null : subPools.remove(database);
        if (sub != null) {
            sub.close();
        }
    }

    /**
     * Drain every sub-pool: idle connections are closed, waiters fail, and connections still leased
     * are closed on release. Intended for process shutdown.
     */
    public void closeAll() {
        if (closed) {
            return;
        }
        closed = true;
        for (String db : List.copyOf(subPools.keySet())) {
            closePool(db);
        }
        if (reaper != null) {
            reaper.shutdownNow();
        }
        log.info("Connection pool closed (acquired={}, released={})", acquired.sum(), released.sum());
    }

    @Override
    public void close() {
        closeAll();
    }

    public boolean isClosed() {
        return closed;
    }

    /** Databases that currently have a live sub-pool. */
    public Set<String> databases() {
        return new TreeSet<>(subPools.keySet());
    }

    public List<PoolStats> stats() {
        return subPools.values().stream()
                .map(SubPool::stats)
                .sorted(Comparator.comparing(PoolStats::database))
                .toList();
    }

    /** Total successful acquisitions since creation. */
    public long acquireCount() {
        return acquired.sum();
    }

    /** Total releases since creation. Equals {@link #acquireCount()} when nothing is leased. */
    public long releaseCount() {
        return released.sum();
    }

    public PoolSettings settings() {
        return settings;
    }

    /** Close idle connections that have sat unused longer than the idle timeout. */
    public int evictIdle() {
        if (settings.idleTimeout().isZero() || settings.idleTimeout().isNegative()) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(settings.idleTimeout());
        int n = 0;
        for (SubPool sub : subPools.values()) {
            n += sub.evictIdleBefore(cutoff);
        }
        return n;
    }

    private SubPool newSubPool(String database) {
        log.info("Creating sub-pool for database {} (maxSize={})", database, settings.maxSize());
        return new SubPool(database, settings.maxSize(), acquired, released);
    }

    private Connection open(ConnectionSettings target) {
        Exception last = null;
        int attempts = settings.connectAttempts();
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                pause(settings.backoffFor(attempt - 1), target);
            }
            try {
                Connection c = clientFactory.openConnection(target);
                log.debug("Opened connection ({})", target.describe());
                return c;
            } catch (Exception e) {
                last = e;
                log.warn("Connection attempt {}/{} failed ({}): {}", attempt + 1, attempts, target.describe(), e.getMessage());
            }
        }
        throw new ConnectionException("Unable to connect to database " + target.database()
                + " after " + attempts + " attempt(s): " + (last == null ? "unknown error" : last.getMessage()), last);
    }

    private static void pause(Duration delay, ConnectionSettings target) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while retrying connection to database " + target.database(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ConnectionException("Connection pool is closed");
        }
    }

    private ScheduledExecutorService startReaper(Duration idleTimeout) {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            return null;
        }
        long period = Math.max(1_000L, idleTimeout.toMillis() / 2);
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pgpulse-pool-reaper");
            t.setDaemon(true);
            return t;
        });
        s.scheduleWithFixedDelay(() -> {
            try {
                evictIdle();
            } catch (RuntimeException e) {
                log.warn("Idle eviction failed: {}", e.toString());
            }
        }, period, period, TimeUnit.MILLISECONDS);
        return s;
    }
}
