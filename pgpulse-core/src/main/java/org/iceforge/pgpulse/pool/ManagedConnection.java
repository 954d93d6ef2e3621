package org.iceforge.pgpulse.pool;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single-owner lease on a pooled connection bound to one database.
 * <p>
 * Use with try-with-resources:
 * <pre>
 *   try (ManagedConnection mc = pool.acquire("orders")) {
 *       Connection conn = mc.connection();
 *       ...
 *   } // released back to the "orders" sub-pool
 * </pre>
 * <p>
 * Releasing is idempotent. A lease is never reused: when the physical connection is handed to the
 * next caller, that caller receives a new {@code ManagedConnection}.
 */
public final class ManagedConnection implements AutoCloseable {

    private final Connection connection;
    private final String database;
    private final Instant acquiredAt;
    private final SubPool owner;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean broken;

    ManagedConnection(Connection connection, String database, SubPool owner) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.database = Objects.requireNonNull(database, "database");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.acquiredAt = Instant.now();
    }

    /**
     * The underlying JDBC connection.
     *
     * @throws IllegalStateException if this lease was already released
     */
    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Connection already released to pool");
        }
        return connection;
    }

    public String database() {
        return database;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    public boolean isBroken() {
        return broken;
    }

    /**
     * Flag the physical connection as unusable (e.g. the socket died). It is closed instead of being
     * recycled when this lease is released.
     */
    public void markBroken() {
        this.broken = true;
    }

    /** Return the connection to its sub-pool. Safe to call any number of times. */
    public void release() {
        if (released.compareAndSet(false, true)) {
            owner.giveBack(this);
        }
    }

    @Override
    public void close() {
        release();
    }

    /** Physical handle, for the owning sub-pool only (ignores the released flag). */
    Connection rawConnection() {
        return connection;
    }

    @Override
    public String toString() {
        return "ManagedConnection{database=" + database + ", acquiredAt=" + acquiredAt
                + ", released=" + released.get() + ", broken=" + broken + "}";
    }
}
