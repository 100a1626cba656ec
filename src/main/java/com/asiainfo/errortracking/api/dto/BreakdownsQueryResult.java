package com.asiainfo.errortracking.api.dto;

import com.asiainfo.errortracking.application.engine.BreakdownsResponse;
import com.asiainfo.errortracking.domain.model.GroupedBreakdownResult;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Map;

/**
 * 拆分查询结果
 */
@RegisterForReflection
public record BreakdownsQueryResult(
        GroupedBreakdownResult results, // 维度 -> {values, total_count}
        String status,                  // 业务状态码
        String msg,                     // 如 查询成功！返回 2 个维度
        String hogql,                   // 实际执行的 SQL
        Map<String, Double> timings,    // 各阶段耗时（毫秒）
        boolean cached
) {

    public static BreakdownsQueryResult success(BreakdownsResponse response, String msg) {
        return new BreakdownsQueryResult(response.results(), "0000", msg,
                response.queryText(), response.timings(), response.cached());
    }

    public static BreakdownsQueryResult error(String status, String errorMsg) {
        return error(status, errorMsg, null, Map.of());
    }

    public static BreakdownsQueryResult error(String status, String errorMsg, String hogql, Map<String, Double> timings) {
        return new BreakdownsQueryResult(GroupedBreakdownResult.empty(), status, errorMsg, hogql, timings, false);
    }
}
