package org.iceforge.pgpulse.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.pgpulse.error.ErrorNormalizer;
import org.iceforge.pgpulse.error.QueryError;
import org.iceforge.pgpulse.error.QueryException;
import org.iceforge.pgpulse.plan.PlanAnalysis;
import org.iceforge.pgpulse.plan.PlanAnalyzer;
import org.iceforge.pgpulse.plan.PlanParser;
import org.iceforge.pgpulse.pool.ConnectionPool;
import org.iceforge.pgpulse.pool.ManagedConnection;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs SQL against pooled connections and returns fully materialized results.
 * <p>
 * Every call leases one connection for its whole duration and always gives it back. A successful
 * statement is followed, on the same connection, by a best-effort
 * {@code EXPLAIN (ANALYZE false, BUFFERS false, FORMAT JSON)} whose plan feeds
 * {@link PerformanceStats}; failures there are logged at debug and dropped.
 * <p>
 * Blocking calls ({@code executeQuery}, {@code explainQuery}, ...) run on the caller's thread.
 * {@link #submit(QueryRequest)} runs on the executor's worker pool and can be cancelled.
 */
public final class QueryExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    static final String EXPLAIN_ANALYZE_PREFIX = "EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) ";
    static final String EXPLAIN_PLAN_PREFIX = "EXPLAIN (ANALYZE false, BUFFERS false, FORMAT JSON) ";
    static final String TEST_SQL = "SELECT 1 AS test";
    static final int DEFAULT_PREVIEW_LIMIT = 100;
    private static final List<String> DML_KEYWORDS = List.of("INSERT", "UPDATE", "DELETE", "MERGE");

    private static final String COLUMNS_SQL = """
            SELECT column_name, data_type, is_nullable, column_default,
                   character_maximum_length, numeric_precision, numeric_scale
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position""";
    private static final String INDEXES_SQL = """
            SELECT indexname AS name, indexdef AS definition
            FROM pg_indexes
            WHERE schemaname = ? AND tablename = ?
            ORDER BY indexname""";
    private static final String CONSTRAINTS_SQL = """
            SELECT constraint_name, constraint_type
            FROM information_schema.table_constraints
            WHERE table_schema = ? AND table_name = ?
            ORDER BY constraint_name""";

    /**
     * @param statementTimeout default per-statement timeout, {@code null} or zero for none
     * @param collectPlanStats run the follow-up EXPLAIN after successful statements
     * @param maxRows          cap on materialized rows, 0 for unlimited
     */
    public record Options(Duration statementTimeout, boolean collectPlanStats, int maxRows) {
        public Options {
            if (maxRows < 0) throw new IllegalArgumentException("maxRows must be >= 0");
        }

        public static Options defaults() {
            return new Options(null, true, 0);
        }

        public Options withStatementTimeout(Duration timeout) {
            return new Options(timeout, collectPlanStats, maxRows);
        }

        public Options withCollectPlanStats(boolean collect) {
            return new Options(statementTimeout, collect, maxRows);
        }

        public Options withMaxRows(int max) {
            return new Options(statementTimeout, collectPlanStats, max);
        }
    }

    private final ConnectionPool pool;
    private final Options options;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final PlanAnalyzer analyzer = new PlanAnalyzer();
    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteEstimator byteEstimator = new ByteEstimator(mapper);

    public QueryExecutor(ConnectionPool pool) {
        this(pool, Options.defaults());
    }

    public QueryExecutor(ConnectionPool pool, Options options) {
        this(pool, options, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pgpulse-query");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /** Uses {@code workers} for {@link #submit}; the caller keeps ownership of it. */
    public QueryExecutor(ConnectionPool pool, Options options, ExecutorService workers) {
        this(pool, options, workers, false);
    }

    private QueryExecutor(ConnectionPool pool, Options options, ExecutorService workers, boolean ownsWorkers) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.options = Objects.requireNonNull(options, "options");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.ownsWorkers = ownsWorkers;
    }

    public QueryResult executeQuery(String sql) {
        return executeQuery(QueryRequest.of(sql));
    }

    public QueryResult executeQuery(String sql, String database) {
        return executeQuery(QueryRequest.of(sql, database));
    }

    public QueryResult executeQuery(String sql, List<?> params, String database) {
        return executeQuery(QueryRequest.of(sql, params, database));
    }

    /**
     * @throws ValidationException if the SQL is blank; no connection is acquired
     * @throws org.iceforge.pgpulse.pool.ConnectionException if no connection could be obtained
     * @throws QueryException if the server rejected the statement
     */
    public QueryResult executeQuery(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        return run(request, request.sql().trim(), options.collectPlanStats(), null);
    }

    /** Runs {@code request} on the worker pool. */
    public QueryHandle submit(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        SqlValidator.require(request.sql());

        InFlight inFlight = new InFlight();
        CompletableFuture<QueryResult> fut = new CompletableFuture<>();
        try {
            workers.execute(() -> {
                if (fut.isDone()) {
                    return;
                }
                try {
                    fut.complete(run(request, request.sql().trim(), options.collectPlanStats(), inFlight));
                } catch (RuntimeException e) {
                    fut.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            fut.completeExceptionally(e);
        }

        return new QueryHandle() {
            @Override
            public void cancel() {
                if (!inFlight.cancel()) {
                    fut.cancel(false);
                }
            }

            @Override
            public CompletableFuture<QueryResult> completion() {
                return fut;
            }
        };
    }

    /** Runs {@code EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON)} for {@code sql}. The statement really executes. */
    public QueryResult explainQuery(String sql, String database) {
        SqlValidator.require(sql);
        QueryRequest request = QueryRequest.of(sql, database);
        return run(request, EXPLAIN_ANALYZE_PREFIX + sql.trim(), false, null);
    }

    public QueryResult explainQuery(String sql) {
        return explainQuery(sql, null);
    }

    public SqlValidation validateSql(String sql) {
        return SqlValidator.validate(sql);
    }

    public String formatSql(String sql) {
        return SqlFormatter.format(sql);
    }

    public QueryResult getTablePreview(String schema, String table, int limit, String database) {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        String sql = "SELECT * FROM " + quoteIdentifier(schema) + "." + quoteIdentifier(table) + " LIMIT " + limit;
        return executeQuery(QueryRequest.of(sql, database));
    }

    public QueryResult getTablePreview(String schema, String table, String database) {
        return getTablePreview(schema, table, DEFAULT_PREVIEW_LIMIT, database);
    }

    /** Columns, indexes and constraints of one table, read on a single connection. */
    public TableInfo getTableInfo(String schema, String table, String database) {
        requireName(schema, "schema");
        requireName(table, "table");
        try (ManagedConnection mc = pool.acquire(database)) {
            Connection conn = mc.connection();
            String current = COLUMNS_SQL;
            try {
                List<Map<String, Object>> columns = catalogRows(conn, COLUMNS_SQL, schema, table);
                current = INDEXES_SQL;
                List<Map<String, Object>> indexes = catalogRows(conn, INDEXES_SQL, schema, table);
                current = CONSTRAINTS_SQL;
                List<Map<String, Object>> constraints = catalogRows(conn, CONSTRAINTS_SQL, schema, table);
                return new TableInfo(columns, indexes, constraints);
            } catch (SQLException e) {
                markIfBroken(mc, e);
                throw new QueryException(ErrorNormalizer.normalize(e, current), e);
            }
        }
    }

    /** {@code true} when {@code SELECT 1} succeeds against {@code database}. Never throws. */
    public boolean testConnection(String database) {
        try {
            run(QueryRequest.of(TEST_SQL, database), TEST_SQL, false, null);
            return true;
        } catch (RuntimeException e) {
            log.warn("Connection test failed for database {}: {}", database, e.getMessage());
            return false;
        }
    }

    /** {@link #testConnection} for every database that currently has a sub-pool. */
    public Map<String, Boolean> healthCheck() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String db : pool.databases()) {
            out.put(db, testConnection(db));
        }
        return out;
    }

    public void closePool(String database) {
        pool.closePool(database);
    }

    public ConnectionPool pool() {
        return pool;
    }

    /** Drains the pool and stops the worker pool if this executor created it. */
    public void cleanup() {
        pool.closeAll();
        if (ownsWorkers) {
            workers.shutdownNow();
        }
    }

    @Override
    public void close() {
        cleanup();
    }

    private QueryResult run(QueryRequest request, String sqlToSend, boolean collectPlan, InFlight inFlight) {
        SqlValidator.require(sqlToSend);
        ParameterMarkerRewriter.Rewrite rewrite = ParameterMarkerRewriter.rewrite(sqlToSend, request.params());

        long t0 = System.nanoTime();
        try (ManagedConnection mc = pool.acquire(request.database())) {
            double connectionTime = millisSince(t0);
            Connection conn = mc.connection();

            Materialized m;
            long t1 = System.nanoTime();
            try (Statement st = open(conn, rewrite, "")) {
                applyTimeout(st, request.timeout() != null ? request.timeout() : options.statementTimeout());
                if (options.maxRows() > 0) {
                    st.setMaxRows(options.maxRows());
                }
                if (inFlight != null) {
                    inFlight.attach(st);
                }
                try {
                    m = materialize(st, rewrite.sql(), isDml(sqlToSend));
                } finally {
                    if (inFlight != null) {
                        inFlight.detach();
                    }
                }
            } catch (SQLException e) {
                markIfBroken(mc, e);
                QueryError error = ErrorNormalizer.normalize(e, sqlToSend);
                log.debug("Query failed on database {}: {} (code={})", mc.database(), error.message(), error.code());
                throw new QueryException(error, e);
            }
            double queryExecutionTime = millisSince(t1);
            double executionTime = millisSince(t0);

            PerformanceStats stats = new PerformanceStats(executionTime, connectionTime, null, queryExecutionTime,
                    byteEstimator.estimate(m.columns(), m.rows()), m.rows().size(), m.affectedRows(),
                    null, null, null);
            if (collectPlan && !isExplain(sqlToSend)) {
                stats = enrich(conn, rewrite, stats);
            }
            return new QueryResult(m.columns(), m.rows(), m.rows().size(), m.affectedRows(), executionTime, stats);
        }
    }

    private PerformanceStats enrich(Connection conn, ParameterMarkerRewriter.Rewrite rewrite, PerformanceStats stats) {
        String explainSql = EXPLAIN_PLAN_PREFIX + rewrite.sql();
        try (Statement st = open(conn, rewrite, EXPLAIN_PLAN_PREFIX)) {
            String planJson = null;
            try (ResultSet rs = st instanceof PreparedStatement ps ? ps.executeQuery() : st.executeQuery(explainSql)) {
                if (rs.next()) {
                    planJson = rs.getString(1);
                }
            }
            PlanAnalysis analysis = analyzer.analyze(PlanParser.parse(planJson));
            return stats.withPlan(analysis);
        } catch (SQLException | RuntimeException e) {
            log.debug("Plan statistics unavailable: {}", e.getMessage());
            return stats;
        }
    }

    /**
     * Parameterless SQL goes through a plain {@link Statement} so that a literal {@code ?} (the jsonb
     * {@code ?}, {@code ?|} and {@code ?&} operators) reaches the server untouched.
     */
    private static Statement open(Connection conn, ParameterMarkerRewriter.Rewrite rewrite, String prefix) throws SQLException {
        if (rewrite.params().isEmpty()) {
            return conn.createStatement();
        }
        PreparedStatement ps = conn.prepareStatement(prefix + rewrite.sql());
        try {
            bind(ps, rewrite.params());
        } catch (SQLException e) {
            try {
                ps.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return ps;
    }

    // DML with RETURNING yields a result set; its rows are the affected rows.
    private Materialized materialize(Statement st, String sql, boolean dml) throws SQLException {
        boolean hasResultSet = st instanceof PreparedStatement ps ? ps.execute() : st.execute(sql);
        if (!hasResultSet) {
            int count = st.getUpdateCount();
            return new Materialized(List.of(), List.of(), count >= 0 ? count : null);
        }
        try (ResultSet rs = st.getResultSet()) {
            ResultSetMetaData md = rs.getMetaData();
            int n = md.getColumnCount();
            List<String> columns = uniqueLabels(md);
            List<Map<String, Object>> rows = new ArrayList<>();
            int max = options.maxRows();
            while (rs.next() && (max == 0 || rows.size() < max)) {
                Map<String, Object> row = new LinkedHashMap<>(n * 2);
                for (int i = 1; i <= n; i++) {
                    row.put(columns.get(i - 1), readValue(rs, i));
                }
                rows.add(Collections.unmodifiableMap(row));
            }
            return new Materialized(columns, rows, dml ? Integer.valueOf(rows.size()) : null);
        }
    }

    private List<Map<String, Object>> catalogRows(Connection conn, String sql, String schema, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            return materialize(ps, sql, false).rows();
        }
    }

    // Duplicate labels (e.g. two "id" columns from a join) get "_2", "_3", ... suffixes.
    private static List<String> uniqueLabels(ResultSetMetaData md) throws SQLException {
        int n = md.getColumnCount();
        List<String> out = new ArrayList<>(n);
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= n; i++) {
            String label = md.getColumnLabel(i);
            if (label == null || label.isEmpty()) {
                label = "?column?";
            }
            String candidate = label;
            for (int k = 2; !seen.add(candidate); k++) {
                candidate = label + "_" + k;
            }
            out.add(candidate);
        }
        return out;
    }

    private Object readValue(ResultSet rs, int index) throws SQLException {
        Object v = rs.getObject(index);
        if (v == null) {
            return null;
        }
        if (v instanceof PGobject pg) {
            return pgValue(pg);
        }
        if (v instanceof Array a) {
            try {
                Object arr = a.getArray();
                return arr instanceof Object[] objs ? Arrays.asList(objs) : arr;
            } finally {
                a.free();
            }
        }
        if (v instanceof Clob clob) {
            return clob.getSubString(1, (int) Math.min(Integer.MAX_VALUE, clob.length()));
        }
        return v;
    }

    private Object pgValue(PGobject pg) {
        String type = pg.getType() == null ? "" : pg.getType().toLowerCase(Locale.ROOT);
        if (pg.getValue() != null && (type.equals("json") || type.equals("jsonb"))) {
            try {
                return mapper.readTree(pg.getValue());
            } catch (JsonProcessingException e) {
                log.debug("Returning {} value as text: {}", type, e.getOriginalMessage());
            }
        }
        return pg.getValue();
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static void applyTimeout(Statement st, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        int seconds = (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
        try {
            st.setQueryTimeout(seconds);
        } catch (SQLException e) {
            log.debug("Driver does not support statement timeouts: {}", e.getMessage());
        }
    }

    private static void markIfBroken(ManagedConnection mc, SQLException e) {
        String state = e.getSQLState();
        if (state != null && (state.startsWith("08") || state.equals("57P01"))) {
            log.warn("Connection to database {} failed ({}); discarding it", mc.database(), state);
            mc.markBroken();
        }
    }

    private static boolean isDml(String sql) {
        for (String keyword : DML_KEYWORDS) {
            if (sql.regionMatches(true, 0, keyword, 0, keyword.length())
                    && (sql.length() == keyword.length() || !Character.isLetterOrDigit(sql.charAt(keyword.length())))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExplain(String sql) {
        return sql.regionMatches(true, 0, "EXPLAIN", 0, 7);
    }

    static String quoteIdentifier(String name) {
        requireName(name, "identifier");
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(what + " must not be blank");
        }
    }

    private static double millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record Materialized(List<String> columns, List<Map<String, Object>> rows, Integer affectedRows) {
    }

    /** Cancellation state shared between a {@link QueryHandle} and the worker running it. */
    private static final class InFlight {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile Statement statement;

        void attach(Statement s) {
            statement = s;
            if (cancelled.get()) {
                statement = null;
                throw new CancellationException("Query cancelled");
            }
        }

        void detach() {
            statement = null;
        }

        /** @return {@code true} if a running statement was asked to stop */
        boolean cancel() {
            cancelled.set(true);
            Statement s = statement;
            if (s == null) {
                return false;
            }
            try {
                s.cancel();
                return true;
            } catch (SQLException e) {
                log.warn("Failed to cancel running statement: {}", e.getMessage());
                return false;
            }
        }
    }
}
