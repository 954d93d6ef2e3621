package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.query.QueryExecutor;
import org.iceforge.pgpulse.query.QueryRequest;
import org.iceforge.pgpulse.query.QueryResult;
import org.iceforge.pgpulse.query.SqlValidation;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Objects;

/**
 * Statement execution for UI panels and tooling.
 * <p>
 * Failures are mapped by {@link QueryExceptionHandler}.
 */
@RestController
@RequestMapping("/api/queries")
public class QueryApiController {

    private final QueryExecutor executor;

    public QueryApiController(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @PostMapping("/execute")
    public QueryResult execute(@RequestBody QueryApiModels.ExecuteRequest req) {
        Duration timeout = req.timeoutMs() == null || req.timeoutMs() <= 0 ? null : Duration.ofMillis(req.timeoutMs());
        return executor.executeQuery(new QueryRequest(req.sql(), req.params(), req.database(), timeout));
    }

    @PostMapping("/explain")
    public QueryResult explain(@RequestBody QueryApiModels.ExplainRequest req) {
        return executor.explainQuery(req.sql(), req.database());
    }

    @PostMapping("/validate")
    public SqlValidation validate(@RequestBody QueryApiModels.SqlRequest req) {
        return executor.validateSql(req.sql());
    }

    @PostMapping("/format")
    public QueryApiModels.FormatResponse format(@RequestBody QueryApiModels.SqlRequest req) {
        return new QueryApiModels.FormatResponse(executor.formatSql(req.sql()));
    }
}
