package org.iceforge.pgpulse.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful statement. {@code columns} are unique and in server field order;
 * {@code affectedRows} is set for statements that report an update count.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        List<String> columns,
        List<Map<String, Object>> rows,
        int rowCount,
        Integer affectedRows,
        double executionTime,
        PerformanceStats performanceStats
) {
    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
    }
}
