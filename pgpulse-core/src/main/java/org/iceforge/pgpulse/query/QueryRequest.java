package org.iceforge.pgpulse.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One statement to run.
 *
 * @param sql      statement text; {@code ?} or PostgreSQL {@code $n} markers
 * @param params   positional values, may contain {@code null}
 * @param database target database, or {@code null} for the configured default
 * @param timeout  statement timeout, or {@code null} for the executor default
 */
public record QueryRequest(
        String sql,
        List<Object> params,
        String database,
        Duration timeout
) {
    public QueryRequest {
        sql = sql == null ? "" : sql;
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        database = database == null || database.isBlank() ? null : database.trim();
    }

    public static QueryRequest of(String sql) {
        return new QueryRequest(sql, null, null, null);
    }

    public static QueryRequest of(String sql, String database) {
        return new QueryRequest(sql, null, database, null);
    }

    public static QueryRequest of(String sql, List<?> params, String database) {
        return new QueryRequest(sql, params == null ? null : new ArrayList<>(params), database, null);
    }

    public QueryRequest withTimeout(Duration timeout) {
        return new QueryRequest(sql, params, database, timeout);
    }
}
