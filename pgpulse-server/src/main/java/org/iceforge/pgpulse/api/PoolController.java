package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.pool.ConnectionPool;
import org.iceforge.pgpulse.query.QueryExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;

/** Connection pool inspection and per-database shutdown. */
@RestController
@RequestMapping("/api/pools")
public class PoolController {

    private final QueryExecutor executor;

    public PoolController(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @GetMapping
    public QueryApiModels.PoolsResponse pools() {
        ConnectionPool pool = executor.pool();
        return new QueryApiModels.PoolsResponse(pool.acquireCount(), pool.releaseCount(), pool.stats());
    }

    @GetMapping("/health")
    public Map<String, Boolean> health() {
        return executor.healthCheck();
    }

    @DeleteMapping("/{database}")
    public ResponseEntity<Void> close(@PathVariable String database) {
        executor.closePool(database);
        return ResponseEntity.noContent().build();
    }
}
