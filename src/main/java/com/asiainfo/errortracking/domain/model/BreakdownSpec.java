package com.asiainfo.errortracking.domain.model;

import com.asiainfo.errortracking.domain.exception.InvalidBreakdownSpecException;

import java.util.List;

/**
 * 拆分查询规格（不可变）
 *
 * @param breakdownProperties 维度名列表，顺序决定 arrayJoin 展开顺序
 * @param dateFrom            起始时间表达式，可为 null
 * @param dateTo              结束时间表达式，可为 null
 * @param filterTestAccounts  是否过滤测试账号
 * @param issueId             被拆分的主体（issue）标识
 * @param limit               每个维度保留的值个数，null 时取默认值
 */
public record BreakdownSpec(
        List<String> breakdownProperties,
        String dateFrom,
        String dateTo,
        boolean filterTestAccounts,
        String issueId,
        Integer limit
) {

    public BreakdownSpec {
        if (breakdownProperties == null || breakdownProperties.isEmpty()) {
            throw new InvalidBreakdownSpecException("breakdownProperties", "must not be empty");
        }
        for (String property : breakdownProperties) {
            if (property == null || property.isBlank()) {
                throw new InvalidBreakdownSpecException("breakdownProperties", "must not contain blank entries");
            }
        }
        if (issueId == null || issueId.isBlank()) {
            throw new InvalidBreakdownSpecException("issueId", "is required");
        }
        breakdownProperties = List.copyOf(breakdownProperties);
    }

    public int effectiveLimit(int defaultLimit) {
        return limit != null ? limit : defaultLimit;
    }
}
