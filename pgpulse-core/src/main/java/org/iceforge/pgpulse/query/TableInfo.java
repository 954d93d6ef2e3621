package org.iceforge.pgpulse.query;

import java.util.List;
import java.util.Map;

/** Catalog description of one table, rows as returned by the catalog queries. */
public record TableInfo(
        List<Map<String, Object>> columns,
        List<Map<String, Object>> indexes,
        List<Map<String, Object>> constraints
) {
    public TableInfo {
        columns = columns == null ? List.of() : List.copyOf(columns);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
