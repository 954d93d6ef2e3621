package org.iceforge.pgpulse.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connections for exactly one database.
 * <p>
 * All bookkeeping ({@code idle}, {@code active}, {@code waiters}) is guarded by {@code lock}.
 * Physical opens and closes happen outside the lock.
 * <p>
 * {@code active} counts connections that are checked out, being opened, or in transit to a
 * waiter, so {@code active + idle.size() <= maxSize} always holds.
 * <p>
 * A waiter's future completes with the connection handed over by a releasing caller, or with
 * {@code null} when the waiter is granted a free slot and must open its own connection.
 */
final class SubPool {
    private static final Logger log = LoggerFactory.getLogger(SubPool.class);

    @FunctionalInterface
    interface Opener {
        Connection open();
    }

    private record IdleConnection(Connection connection, Instant idleSince) {}

    private final String database;
    private final int maxSize;
    private final LongAdder acquired;
    private final LongAdder released;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<IdleConnection> idle = new ArrayDeque<>();
    private final Deque<CompletableFuture<Connection>> waiters = new ArrayDeque<>();
    private int active;
    private boolean closed;

    SubPool(String database, int maxSize, LongAdder acquired, LongAdder released) {
        this.database = database;
        this.maxSize = maxSize;
        this.acquired = acquired;
        this.released = released;
    }

    String database() {
        return database;
    }

    ManagedConnection acquire(Opener opener, Duration timeout) {
        CompletableFuture<Connection> waiter = null;
        List<Connection> stale = new ArrayList<>();
        Connection reused = null;

        lock.lock();
        try {
            if (closed) {
                throw new ConnectionException("Connection pool for database " + database + " is closed");
            }
            IdleConnection ic;
            while (reused == null && (ic = idle.pollLast()) != null) {
                if (isUsable(ic.connection())) {
                    reused = ic.connection();
                } else {
                    stale.add(ic.connection());
                }
            }
            if (reused != null || active < maxSize) {
                active++;
            } else {
                waiter = new CompletableFuture<>();
                waiters.addLast(waiter);
            }
        } finally {
            lock.unlock();
        }

        if (!stale.isEmpty()) {
            log.debug("Discarding {} dead idle connection(s) for database {}", stale.size(), database);
            stale.forEach(SubPool::closeQuietly);
        }
        if (reused != null) {
            return lease(reused);
        }
        if (waiter == null) {
            return openInSlot(opener);
        }

        Connection handed = await(waiter, timeout);
        return handed != null ? lease(handed) : openInSlot(opener);
    }

    /** Called exactly once per lease, from {@link ManagedConnection#release()}. */
    void giveBack(ManagedConnection mc) {
        released.increment();
        recycle(mc.rawConnection(), !mc.isBroken());
    }

    /** Close idle connections now and fail pending waiters; leased ones close when released. */
    void close() {
        List<Connection> toClose = new ArrayList<>();
        List<CompletableFuture<Connection>> pending;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            idle.forEach(ic -> toClose.add(ic.connection()));
            idle.clear();
            pending = new ArrayList<>(waiters);
            waiters.clear();
        } finally {
            lock.unlock();
        }

        toClose.forEach(SubPool::closeQuietly);
        ConnectionException closedError = new ConnectionException("Connection pool for database " + database + " is closed");
        pending.forEach(w -> w.completeExceptionally(closedError));
        log.info("Closed sub-pool for database {} ({} idle closed, {} waiter(s) failed)", database, toClose.size(), pending.size());
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    int evictIdleBefore(Instant cutoff) {
        List<Connection> evicted = new ArrayList<>();
        lock.lock();
        try {
            Iterator<IdleConnection> it = idle.iterator();
            while (it.hasNext()) {
                IdleConnection ic = it.next();
                if (ic.idleSince().isBefore(cutoff)) {
                    evicted.add(ic.connection());
                    it.remove();
                }
            }
        } finally {
            lock.unlock();
        }
        evicted.forEach(SubPool::closeQuietly);
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} idle connection(s) for database {}", evicted.size(), database);
        }
        return evicted.size();
    }

    PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(database, active, idle.size(), waiters.size(), maxSize, closed);
        } finally {
            lock.unlock();
        }
    }

    private ManagedConnection lease(Connection c) {
        acquired.increment();
        return new ManagedConnection(c, database, this);
    }

    private ManagedConnection openInSlot(Opener opener) {
        try {
            return lease(opener.open());
        } catch (RuntimeException | Error e) {
            releaseSlot();
            throw e;
        }
    }

    private Connection await(CompletableFuture<Connection> waiter, Duration timeout) {
        try {
            return waiter.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (abandon(waiter)) {
                throw new ConnectionException("Timed out after " + timeout.toMillis()
                        + " ms waiting for a connection to database " + database);
            }
            // Served between the timeout and the abandon attempt.
            return joinGrant(waiter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!abandon(waiter)) {
                returnGrant(joinGrant(waiter));
            }
            throw new ConnectionException("Interrupted while waiting for a connection to database " + database, e);
        } catch (ExecutionException e) {
            throw asConnectionException(e.getCause());
        }
    }

    private Connection joinGrant(CompletableFuture<Connection> waiter) {
        try {
            return waiter.join();
        } catch (CompletionException e) {
            throw asConnectionException(e.getCause());
        }
    }

    private void returnGrant(Connection granted) {
        if (granted != null) {
            recycle(granted, true);
        } else {
            releaseSlot();
        }
    }

    private boolean abandon(CompletableFuture<Connection> waiter) {
        lock.lock();
        try {
            return waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    private void recycle(Connection c, boolean healthy) {
        boolean usable = healthy && isUsable(c);
        CompletableFuture<Connection> next;
        Connection handOff = null;
        boolean discard = false;

        lock.lock();
        try {
            if (closed || !usable) {
                discard = true;
                next = closed ? null : waiters.pollFirst();
                if (next == null) {
                    active--;
                }
                // otherwise the slot passes to the waiter, which opens a fresh connection
            } else {
                next = waiters.pollFirst();
                if (next != null) {
                    handOff = c;
                } else {
                    active--;
                    idle.addLast(new IdleConnection(c, Instant.now()));
                }
            }
        } finally {
            lock.unlock();
        }

        if (discard) {
            if (!usable) {
                log.warn("Discarding unhealthy connection for database {}", database);
            }
            closeQuietly(c);
        }
        if (next != null) {
            next.complete(handOff);
        }
    }

    private void releaseSlot() {
        CompletableFuture<Connection> next;
        lock.lock();
        try {
            next = closed ? null : waiters.pollFirst();
            if (next == null) {
                active--;
            }
        } finally {
            lock.unlock();
        }
        if (next != null) {
            next.complete(null);
        }
    }

    private static ConnectionException asConnectionException(Throwable t) {
        if (t instanceof ConnectionException ce) {
            return ce;
        }
        return new ConnectionException("Failed waiting for connection: " + t, t);
    }

    private static boolean isUsable(Connection c) {
        try {
            return !c.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    private static void closeQuietly(Connection c) {
        try {
            c.close();
        } catch (SQLException e) {
            log.debug("Error closing connection: {}", e.getMessage());
        }
    }
}
