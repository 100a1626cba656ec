package com.asiainfo.errortracking.application.engine;

import com.asiainfo.errortracking.domain.model.GroupedBreakdownResult;

import java.util.Map;

/**
 * 一次拆分查询的完整输出
 *
 * @param results   按维度分组后的结果
 * @param queryText 实际执行的 SQL
 * @param timings   各阶段耗时（毫秒）
 * @param cached    是否来自缓存
 */
public record BreakdownsResponse(
        GroupedBreakdownResult results,
        String queryText,
        Map<String, Double> timings,
        boolean cached
) {

    public BreakdownsResponse asCached() {
        return new BreakdownsResponse(results, queryText, timings, true);
    }
}
