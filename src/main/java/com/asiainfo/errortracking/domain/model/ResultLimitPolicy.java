package com.asiainfo.errortracking.domain.model;

/**
 * 结果集大小上限，计划本身没有 LIMIT 时由执行器补上
 */
public record ResultLimitPolicy(int maxRows) {

    public ResultLimitPolicy {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
        }
    }
}
