package org.iceforge.pgpulse.pool;

/** Point-in-time view of one sub-pool. */
public record PoolStats(
        String database,
        int active,
        int idle,
        int waiting,
        int maxSize,
        boolean closed
) {
}
