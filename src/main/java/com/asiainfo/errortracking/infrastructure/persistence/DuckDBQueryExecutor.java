package com.asiainfo.errortracking.infrastructure.persistence;

import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.exception.QueryExecutionException;
import com.asiainfo.errortracking.domain.generator.SqlGenerator;
import com.asiainfo.errortracking.domain.model.ExecutionContext;
import com.asiainfo.errortracking.domain.model.FlatResultRow;
import com.asiainfo.errortracking.domain.model.QueryResult;
import com.asiainfo.errortracking.domain.model.QueryTimings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static com.asiainfo.errortracking.domain.ast.Ast.constant;
import static com.asiainfo.errortracking.domain.model.BreakdownConstants.EVENTS_TABLE;

/**
 * 基于 DuckDB 的查询执行器
 * 计划 -> SQL（带租户过滤和结果上限）-> JDBC 执行 -> 按列位置映射为 FlatResultRow
 */
@ApplicationScoped
public class DuckDBQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(DuckDBQueryExecutor.class);

    @Inject
    SqlGenerator sqlGenerator;

    @Inject
    MeterRegistry registry;

    @Inject
    @io.quarkus.agroal.DataSource("duckdb")
    DataSource duckdbDs;

    @ConfigProperty(name = "breakdowns.events.table", defaultValue = "events")
    String eventsTable = EVENTS_TABLE;

    @Override
    public QueryResult execute(SelectQuery plan, ExecutionContext ctx) {
        QueryTimings timings = ctx.timings();

        // 计划没有 LIMIT 时由结果上限兜底
        SelectQuery governed = plan.limit() == null
                ? plan.withLimit(constant(ctx.limitPolicy().maxRows()))
                : plan;

        String sql = timings.measure("sql_print", () -> sqlGenerator.generateSql(
                governed, new SqlGenerator.PrintContext(ctx.team().id(), eventsTable)));
        log.debug("[DuckDB] team={}, sql={}", ctx.team().id(), sql);

        long start = System.nanoTime();
        try {
            List<FlatResultRow> rows = Timer.builder("breakdowns.duckdb.query.time")
                    .description("DuckDB breakdown query execution time")
                    .register(registry)
                    .recordCallable(() -> executeAndMap(sql));
            log.debug("[DuckDB] Executed in {} ms, rows: {}", (System.nanoTime() - start) / 1_000_000, rows.size());
            timings.record("duckdb_execute", System.nanoTime() - start);
            return new QueryResult(rows, sql, timings.snapshot());
        } catch (Exception e) {
            timings.record("duckdb_execute", System.nanoTime() - start);
            log.error("DuckDB Query Failed: {}", sql, e);
            throw new QueryExecutionException("DuckDB query failed: " + e.getMessage(), sql, timings.snapshot(), e);
        }
    }

    private List<FlatResultRow> executeAndMap(String sql) throws SQLException {
        try (Connection conn = duckdbDs.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            List<FlatResultRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new FlatResultRow(
                        String.valueOf(rs.getObject(1)),
                        String.valueOf(rs.getObject(2)),
                        toLong(rs.getObject(3)),
                        toLong(rs.getObject(4))));
            }
            return rows;
        }
    }

    // sum(count(*)) 在 DuckDB 中是 HUGEINT，JDBC 返回 BigInteger
    private static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
