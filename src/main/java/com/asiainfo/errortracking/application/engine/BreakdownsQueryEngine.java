package com.asiainfo.errortracking.application.engine;

import com.asiainfo.errortracking.common.config.BreakdownsConfig;
import com.asiainfo.errortracking.domain.ast.SelectQuery;
import com.asiainfo.errortracking.domain.generator.BreakdownPlanBuilder;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.ExecutionContext;
import com.asiainfo.errortracking.domain.model.GroupedBreakdownResult;
import com.asiainfo.errortracking.domain.model.QueryResult;
import com.asiainfo.errortracking.domain.model.QueryTimings;
import com.asiainfo.errortracking.domain.model.ResolvedWindow;
import com.asiainfo.errortracking.domain.model.ResultLimitPolicy;
import com.asiainfo.errortracking.domain.model.Team;
import com.asiainfo.errortracking.domain.parser.DateRangeResolver;
import com.asiainfo.errortracking.infrastructure.cache.BreakdownsCache;
import com.asiainfo.errortracking.infrastructure.cache.BreakdownsCacheKey;
import com.asiainfo.errortracking.infrastructure.persistence.QueryExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 错误追踪拆分查询引擎
 * <p>
 * 流程：缓存查找 -> 解析时间窗口 -> 构造计划 -> 执行 -> 按维度重组 -> 写缓存。
 * 各阶段的异常原样向上抛出，由 API 层转换为状态码。
 */
@ApplicationScoped
public class BreakdownsQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(BreakdownsQueryEngine.class);

    @Inject
    Clock clock;

    @Inject
    DateRangeResolver dateRangeResolver;

    @Inject
    BreakdownPlanBuilder planBuilder;

    @Inject
    QueryExecutor queryExecutor;

    @Inject
    BreakdownResultGrouper grouper;

    @Inject
    BreakdownsCache cache;

    @Inject
    BreakdownsConfig config;

    public BreakdownsResponse execute(BreakdownSpec spec, Team team) {
        long startTime = System.currentTimeMillis();

        int limit = spec.effectiveLimit(config.getDefaultLimit());
        BreakdownsCacheKey cacheKey = BreakdownsCacheKey.of(team, spec, limit);
        BreakdownsResponse hit = cache.get(cacheKey);
        if (hit != null) {
            log.info("[Breakdowns] Cache hit, team={}, issue={}", team.id(), spec.issueId());
            return hit.asCached();
        }

        QueryTimings timings = new QueryTimings();

        Instant now = clock.instant();
        ResolvedWindow window = timings.measure("resolve_dates",
                () -> dateRangeResolver.resolve(spec.dateFrom(), spec.dateTo(), now));
        log.debug("[Breakdowns] Resolved window [{}, {}] for issue {}", window.from(), window.to(), spec.issueId());

        SelectQuery plan = timings.measure("build_plan", () -> planBuilder.build(spec, window, limit));

        ExecutionContext ctx = new ExecutionContext(team, timings, new ResultLimitPolicy(config.getMaxRows()));
        QueryResult result = timings.measure("execute", () -> queryExecutor.execute(plan, ctx));

        GroupedBreakdownResult grouped = timings.measure("group_results", () -> grouper.group(result.rows()));

        BreakdownsResponse response = new BreakdownsResponse(grouped, result.queryText(), timings.snapshot(), false);
        cache.put(cacheKey, response);

        log.info("[Breakdowns] team={}, issue={}, dimensions={}, rows={}, cost={}ms",
                team.id(), spec.issueId(), grouped.size(), result.rows().size(),
                System.currentTimeMillis() - startTime);
        return response;
    }
}
