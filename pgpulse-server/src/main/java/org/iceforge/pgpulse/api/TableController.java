package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.query.QueryExecutor;
import org.iceforge.pgpulse.query.QueryResult;
import org.iceforge.pgpulse.query.TableInfo;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

@RestController
@RequestMapping("/api/tables/{schema}/{table}")
public class TableController {

    private final QueryExecutor executor;

    public TableController(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @GetMapping("/preview")
    public QueryResult preview(@PathVariable String schema,
                               @PathVariable String table,
                               @RequestParam(value = "limit", defaultValue = "100") int limit,
                               @RequestParam(value = "database", required = false) String database) {
        return executor.getTablePreview(schema, table, limit, database);
    }

    @GetMapping("/info")
    public TableInfo info(@PathVariable String schema,
                          @PathVariable String table,
                          @RequestParam(value = "database", required = false) String database) {
        return executor.getTableInfo(schema, table, database);
    }
}
