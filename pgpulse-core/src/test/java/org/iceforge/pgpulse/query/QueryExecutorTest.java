package org.iceforge.pgpulse.query;

import org.iceforge.pgpulse.error.QueryException;
import org.iceforge.pgpulse.jdbc.StaticConnectionConfigProvider;
import org.iceforge.pgpulse.jdbc.spi.JdbcClientFactory;
import org.iceforge.pgpulse.pool.ConnectionPool;
import org.iceforge.pgpulse.pool.PoolSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Runs the executor against in-memory H2 databases. */
class QueryExecutorTest {

    private static final String H2_URL = "jdbc:h2:mem:{database};MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    private static final AtomicInteger SEQ = new AtomicInteger();

    private String db;
    private ConnectionPool pool;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        db = "qe" + SEQ.incrementAndGet();
        StaticConnectionConfigProvider config = StaticConnectionConfigProvider.builder()
                .jdbcUrlTemplate(H2_URL)
                .defaultDatabase(db)
                .build();
        pool = new ConnectionPool(config, JdbcClientFactory.withDefaults(),
                PoolSettings.defaults().withConnectRetry(1, Duration.ZERO, Duration.ZERO));
        executor = new QueryExecutor(pool);

        executor.executeQuery("CREATE TABLE items (id INT PRIMARY KEY, name VARCHAR(50), price DECIMAL(10,2))", db);
        executor.executeQuery("INSERT INTO items VALUES (1, 'bolt', 0.25), (2, 'widget', 3.50)", db);
    }

    @AfterEach
    void tearDown() {
        executor.cleanup();
    }

    @Test
    void selectReturnsColumnsRowsAndStats() {
        QueryResult r = executor.executeQuery("SELECT id, name FROM items ORDER BY id", db);

        assertThat(r.columns()).containsExactly("id", "name");
        assertThat(r.rowCount()).isEqualTo(2);
        assertThat(r.rows()).extracting(row -> row.get("name")).containsExactly("bolt", "widget");
        assertThat(r.affectedRows()).isNull();
        assertThat(r.executionTime()).isGreaterThanOrEqualTo(0.0);

        PerformanceStats stats = r.performanceStats();
        assertThat(stats).isNotNull();
        assertThat(stats.rowsReturned()).isEqualTo(2);
        assertThat(stats.bytesReceived()).isGreaterThan(0);
        assertThat(stats.connectionTime()).isLessThanOrEqualTo(r.executionTime());
        // H2 does not understand the PostgreSQL EXPLAIN options; the result is still complete.
        assertThat(stats.queryComplexity()).isNull();
    }

    @Test
    void dmlReportsAffectedRows() {
        QueryResult r = executor.executeQuery("UPDATE items SET price = price + 1", db);

        assertThat(r.affectedRows()).isEqualTo(2);
        assertThat(r.columns()).isEmpty();
        assertThat(r.rowCount()).isZero();
        assertThat(r.performanceStats().rowsAffected()).isEqualTo(2);
    }

    @Test
    void bindsPostgresAndJdbcStyleParameters() {
        QueryResult dollar = executor.executeQuery("SELECT name FROM items WHERE id = $1", List.of(2), db);
        QueryResult qmark = executor.executeQuery("SELECT name FROM items WHERE id = ?", List.of(1), db);

        assertThat(dollar.rows()).singleElement().isEqualTo(Map.of("name", "widget"));
        assertThat(qmark.rows()).singleElement().isEqualTo(Map.of("name", "bolt"));
    }

    @Test
    void returnedRowsCannotBeModified() {
        QueryResult r = executor.executeQuery("SELECT id, name FROM items ORDER BY id", db);

        assertThatThrownBy(() -> r.rows().get(0).put("name", "tampered"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> r.rows().remove(0)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(r.rows().get(0)).containsEntry("name", "bolt");
    }

    @Test
    void rowCapLimitsMaterializedRows() {
        try (QueryExecutor capped = new QueryExecutor(pool, QueryExecutor.Options.defaults().withMaxRows(1))) {
            QueryResult r = capped.executeQuery("SELECT id FROM items ORDER BY id", db);

            assertThat(r.rowCount()).isEqualTo(1);
            assertThat(r.rows()).singleElement().isEqualTo(Map.of("id", 1));
        }
    }

    @Test
    void duplicateColumnLabelsAreMadeUnique() {
        QueryResult r = executor.executeQuery("SELECT id, id, name AS id FROM items WHERE id = 1", db);

        assertThat(r.columns()).containsExactly("id", "id_2", "id_3");
        assertThat(r.rows().get(0)).containsEntry("id_3", "bolt");
    }

    @Test
    void blankSqlFailsWithoutTouchingThePool() {
        long before = pool.acquireCount();

        assertThatThrownBy(() -> executor.executeQuery("", db)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> executor.executeQuery("   ", db)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> executor.executeQuery(QueryRequest.of(null))).isInstanceOf(ValidationException.class);

        assertThat(pool.acquireCount()).isEqualTo(before);
    }

    @Test
    void serverErrorIsNormalizedAndConnectionReleased() {
        assertThatThrownBy(() -> executor.executeQuery("SELECT nope FROM items", db))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.error().message()).isNotBlank();
                    assertThat(e.error().code()).isNotBlank();
                });

        assertThat(pool.acquireCount()).isEqualTo(pool.releaseCount());
        assertThat(executor.executeQuery("SELECT 1", db).rowCount()).isEqualTo(1);
    }

    @Test
    void acquireAndReleaseStayBalancedAcrossMixedOutcomes() {
        Random rnd = new Random(42);
        for (int i = 0; i < 300; i++) {
            String sql = rnd.nextInt(3) == 0 ? "SELECT missing_column FROM items" : "SELECT id FROM items";
            try {
                executor.executeQuery(sql, db);
            } catch (QueryException expected) {
                assertThat(expected.error()).isNotNull();
            }
        }

        assertThat(pool.acquireCount()).isEqualTo(pool.releaseCount());
        assertThat(pool.stats()).allSatisfy(s -> assertThat(s.active()).isZero());
    }

    @Test
    void tablePreviewQuotesIdentifiersAndLimits() {
        QueryResult r = executor.getTablePreview("public", "items", 1, db);

        assertThat(r.rowCount()).isEqualTo(1);
        assertThat(r.columns()).containsExactly("id", "name", "price");
        assertThatThrownBy(() -> executor.getTablePreview("public", "items", 0, db))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void tableInfoReadsCatalog() {
        // H2 has no pg_indexes view; a table with the same shape stands in for it.
        executor.executeQuery("CREATE TABLE pg_indexes (schemaname VARCHAR, tablename VARCHAR, indexname VARCHAR, indexdef VARCHAR)", db);
        executor.executeQuery("INSERT INTO pg_indexes VALUES ('public', 'items', 'items_pkey', 'CREATE UNIQUE INDEX items_pkey ON public.items (id)')", db);

        TableInfo info = executor.getTableInfo("public", "items", db);

        assertThat(info.columns()).extracting(c -> c.get("column_name")).containsExactly("id", "name", "price");
        assertThat(info.indexes()).singleElement().satisfies(i -> assertThat(i.get("name")).isEqualTo("items_pkey"));
        assertThat(info.constraints()).extracting(c -> c.get("constraint_type")).contains("PRIMARY KEY");
        assertThat(pool.acquireCount()).isEqualTo(pool.releaseCount());
    }

    @Test
    void connectionTestAndHealthCheck() {
        assertThat(executor.testConnection(db)).isTrue();
        assertThat(executor.healthCheck()).containsExactly(Map.entry(db, true));

        StaticConnectionConfigProvider missing = StaticConnectionConfigProvider.builder()
                .jdbcUrlTemplate("jdbc:h2:mem:{database};IFEXISTS=TRUE")
                .defaultDatabase("does_not_exist")
                .build();
        try (QueryExecutor other = new QueryExecutor(new ConnectionPool(missing, JdbcClientFactory.withDefaults(),
                PoolSettings.defaults().withConnectRetry(1, Duration.ZERO, Duration.ZERO)))) {
            assertThat(other.testConnection(null)).isFalse();
        }
    }

    @Test
    void submitCompletesAsynchronously() throws Exception {
        QueryHandle handle = executor.submit(QueryRequest.of("SELECT count(*) AS n FROM items", db));

        QueryResult r = handle.completion().get(10, TimeUnit.SECONDS);
        assertThat(r.rows()).singleElement().satisfies(row -> assertThat(((Number) row.get("n")).intValue()).isEqualTo(2));
    }

    @Test
    void closePoolDropsTheSubPool() {
        executor.executeQuery("SELECT 1", db);
        assertThat(pool.databases()).contains(db);

        executor.closePool(db);

        assertThat(pool.databases()).doesNotContain(db);
        assertThat(executor.executeQuery("SELECT count(*) FROM items", db).rowCount()).isEqualTo(1);
    }

    @Test
    void validateAndFormatDelegate() {
        assertThat(executor.validateSql("DROP TABLE items").warnings()).isNotEmpty();
        assertThat(executor.formatSql("select a from b")).isEqualTo("SELECT a\nFROM b");
    }
}
