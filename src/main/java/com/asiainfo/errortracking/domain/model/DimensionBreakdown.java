package com.asiainfo.errortracking.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 单个维度的拆分结果
 *
 * @param totalCount 该维度所有取值（排名过滤前）的事件总数
 * @param values     排名靠前的取值，按计数降序
 */
public record DimensionBreakdown(
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("values") List<BreakdownValue> values
) {

    public DimensionBreakdown {
        values = List.copyOf(values);
    }
}
