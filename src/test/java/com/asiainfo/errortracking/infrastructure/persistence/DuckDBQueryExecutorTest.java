package com.asiainfo.errortracking.infrastructure.persistence;

import com.asiainfo.errortracking.domain.exception.QueryExecutionException;
import com.asiainfo.errortracking.domain.generator.BreakdownPlanBuilder;
import com.asiainfo.errortracking.domain.generator.GeneratorTestSupport;
import com.asiainfo.errortracking.domain.generator.SqlGenerator;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.ExecutionContext;
import com.asiainfo.errortracking.domain.model.FlatResultRow;
import com.asiainfo.errortracking.domain.model.QueryResult;
import com.asiainfo.errortracking.domain.model.QueryTimings;
import com.asiainfo.errortracking.domain.model.ResolvedWindow;
import com.asiainfo.errortracking.domain.model.ResultLimitPolicy;
import com.asiainfo.errortracking.domain.model.Team;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.duckdb.DuckDBConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 在内存 DuckDB 上执行完整的拆分计划
 */
class DuckDBQueryExecutorTest {

    private static final Logger log = LoggerFactory.getLogger(DuckDBQueryExecutorTest.class);

    private static final String NULL_SENTINEL = "$$_posthog_breakdown_null_$$";
    private static final ResolvedWindow WINDOW = new ResolvedWindow(
            Instant.parse("2024-05-08T10:30:00Z"), Instant.parse("2024-05-15T10:30:00Z"));
    private static final String IN_WINDOW = "2024-05-10 12:00:00";

    private DuckDBConnection base;
    private DuckDBQueryExecutor executor;
    private SimpleMeterRegistry registry;
    private final BreakdownPlanBuilder planBuilder = GeneratorTestSupport.newPlanBuilder(3);

    @BeforeEach
    void setUp() throws Exception {
        base = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        try (Statement stmt = base.createStatement()) {
            stmt.execute("CREATE TABLE events (team_id BIGINT, event VARCHAR, \"timestamp\" TIMESTAMP, properties VARCHAR)");
        }

        // Chrome x10, Firefox x5, Safari x5, Edge x1
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":\"Chrome\",\"$os\":\"Mac OS X\",\"$exception_issue_id\":\"issue-1\",\"$is_identified\":true}", 10);
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":\"Firefox\",\"$os\":\"Windows\",\"$exception_issue_id\":\"issue-1\"}", 5);
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":\"Safari\",\"$os\":\"iOS\",\"$exception_issue_id\":\"issue-1\"}", 5);
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":\"Edge\",\"$os\":\"Windows\",\"$exception_issue_id\":\"issue-1\",\"$is_identified\":true}", 1);

        // 以下都不应被统计
        insert(2, "$exception", IN_WINDOW, "{\"$browser\":\"Opera\",\"$exception_issue_id\":\"issue-1\"}", 100);
        insert(1, "$exception", "2024-04-01 00:00:00", "{\"$browser\":\"Opera\",\"$exception_issue_id\":\"issue-1\"}", 100);
        insert(1, "$pageview", IN_WINDOW, "{\"$browser\":\"Opera\",\"$exception_issue_id\":\"issue-1\"}", 100);
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":\"Opera\",\"$exception_issue_id\":\"issue-2\"}", 100);

        DataSource ds = Mockito.mock(DataSource.class);
        Mockito.when(ds.getConnection()).thenAnswer(inv -> base.duplicate());

        registry = new SimpleMeterRegistry();
        executor = new DuckDBQueryExecutor();
        executor.sqlGenerator = new SqlGenerator();
        executor.registry = registry;
        executor.duckdbDs = ds;
    }

    @AfterEach
    void tearDown() throws SQLException {
        base.close();
    }

    private void insert(long teamId, String event, String timestamp, String properties, int times) throws SQLException {
        try (Statement stmt = base.createStatement()) {
            stmt.execute(String.format(
                    "INSERT INTO events SELECT %d, '%s', TIMESTAMP '%s', '%s' FROM range(%d)",
                    teamId, event, timestamp, properties, times));
        }
    }

    private QueryResult run(BreakdownSpec spec, int maxRows) {
        ExecutionContext ctx = new ExecutionContext(new Team(1), new QueryTimings(), new ResultLimitPolicy(maxRows));
        QueryResult result = executor.execute(planBuilder.build(spec, WINDOW), ctx);
        log.info("SQL: {}", result.queryText());
        log.info("Rows: {}", result.rows());
        return result;
    }

    private static BreakdownSpec spec(List<String> properties, boolean filterTestAccounts, Integer limit) {
        return new BreakdownSpec(properties, null, null, filterTestAccounts, "issue-1", limit);
    }

    @Test
    void testTopValuesPerDimension() {
        QueryResult result = run(spec(List.of("$browser"), false, 2), 10000);
        List<FlatResultRow> rows = result.rows();

        assertEquals(2, rows.size());
        assertEquals(new FlatResultRow("$browser", "Chrome", 10, 21), rows.get(0));

        FlatResultRow second = rows.get(1);
        assertTrue(Set.of("Firefox", "Safari").contains(second.dimensionValue()), "并列第二名取其一");
        assertEquals(5, second.count());
        assertEquals(21, second.totalCountForDimension());
    }

    @Test
    void testTotalCountIndependentOfLimit() {
        for (int limit : new int[]{1, 2, 3, 10}) {
            List<FlatResultRow> rows = run(spec(List.of("$browser"), false, limit), 10000).rows();
            assertEquals(Math.min(limit, 4), rows.size());
            rows.forEach(row -> assertEquals(21, row.totalCountForDimension()));
        }
    }

    @Test
    void testNonPositiveLimitReturnsNothing() {
        assertTrue(run(spec(List.of("$browser"), false, 0), 10000).rows().isEmpty());
    }

    @Test
    void testMultipleDimensionsOrderedByName() {
        List<FlatResultRow> rows = run(spec(List.of("$os", "$browser"), false, 1), 10000).rows();

        assertEquals(List.of("$browser", "$os"),
                rows.stream().map(FlatResultRow::dimensionName).collect(Collectors.toList()));
        assertEquals(new FlatResultRow("$os", "Mac OS X", 10, 21), rows.get(1));
    }

    @Test
    void testMissingPropertyUsesSentinel() {
        List<FlatResultRow> rows = run(spec(List.of("$device_type"), false, 3), 10000).rows();

        assertEquals(List.of(new FlatResultRow("$device_type", NULL_SENTINEL, 21, 21)), rows);
    }

    @Test
    void testExplicitNullUsesSentinel() throws SQLException {
        insert(1, "$exception", IN_WINDOW, "{\"$browser\":null,\"$exception_issue_id\":\"issue-1\"}", 3);

        List<FlatResultRow> rows = run(spec(List.of("$browser"), false, 10), 10000).rows();

        assertEquals(5, rows.size());
        assertTrue(rows.contains(new FlatResultRow("$browser", NULL_SENTINEL, 3, 24)));
        rows.forEach(row -> assertEquals(24, row.totalCountForDimension()));
    }

    @Test
    void testFilterTestAccounts() {
        List<FlatResultRow> rows = run(spec(List.of("$browser"), true, 5), 10000).rows();

        assertEquals(List.of(
                new FlatResultRow("$browser", "Chrome", 10, 11),
                new FlatResultRow("$browser", "Edge", 1, 11)), rows);
    }

    @Test
    void testMaxRowsIsApplied() {
        QueryResult result = run(spec(List.of("$browser"), false, 3), 1);

        assertEquals(1, result.rows().size());
        assertTrue(result.queryText().endsWith("LIMIT 1"));
    }

    @Test
    void testTimingsAndMetrics() {
        QueryResult result = run(spec(List.of("$browser"), false, 3), 10000);

        assertTrue(result.timings().containsKey("sql_print"));
        assertTrue(result.timings().containsKey("duckdb_execute"));
        assertEquals(1, registry.get("breakdowns.duckdb.query.time").timer().count());
    }

    @Test
    void testExecutionFailureCarriesQueryText() {
        executor.eventsTable = "missing_events";

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> run(spec(List.of("$browser"), false, 3), 10000));

        assertEquals("9999", e.getStatusCode());
        assertTrue(e.getQueryText().contains("\"missing_events\""));
        assertTrue(e.getTimings().containsKey("duckdb_execute"));
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
