package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.pool.PoolStats;

import java.util.List;

public final class QueryApiModels {
    private QueryApiModels() {
    }

    /**
     * @param params    positional values for {@code $n} or {@code ?} markers
     * @param timeoutMs statement timeout; absent uses the server default
     */
    public record ExecuteRequest(
            String sql,
            List<Object> params,
            String database,
            Long timeoutMs
    ) {
    }

    public record ExplainRequest(
            String sql,
            String database
    ) {
    }

    public record SqlRequest(
            String sql
    ) {
    }

    public record FormatResponse(
            String sql
    ) {
    }

    public record PoolsResponse(
            long acquireCount,
            long releaseCount,
            List<PoolStats> pools
    ) {
    }

    public record ErrorResponse(
            String error,
            String message
    ) {
    }
}
