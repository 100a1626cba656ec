package com.asiainfo.errortracking.api.dto;

import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 拆分查询请求
 */
@RegisterForReflection
public record BreakdownsQueryRequest(
        List<String> breakdownProperties, // 维度列表，如 ["$browser", "$os"]
        DateRange dateRange,              // 时间范围，可为空
        Boolean filterTestAccounts,       // 是否过滤测试账号，默认 false
        String issueId,                   // issue 标识
        Integer limit                     // 每个维度的取值个数
) {

    @RegisterForReflection
    public record DateRange(
            @JsonProperty("date_from") String dateFrom,
            @JsonProperty("date_to") String dateTo
    ) {
    }

    /**
     * 转换为领域规格，非法时抛出 InvalidBreakdownSpecException
     */
    public BreakdownSpec toSpec() {
        return new BreakdownSpec(
                breakdownProperties,
                dateRange != null ? dateRange.dateFrom() : null,
                dateRange != null ? dateRange.dateTo() : null,
                Boolean.TRUE.equals(filterTestAccounts),
                issueId,
                limit);
    }
}
