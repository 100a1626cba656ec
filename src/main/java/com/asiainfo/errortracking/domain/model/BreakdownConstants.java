package com.asiainfo.errortracking.domain.model;

public class BreakdownConstants {
    // 维度值缺失时的占位串，保证后续分组/排序阶段的值列非空
    public static final String NULL_SENTINEL = "$$_posthog_breakdown_null_$$";

    public static final String EXCEPTION_EVENT = "$exception";
    public static final String ISSUE_ID_PROPERTY = "$exception_issue_id";
    public static final String IS_IDENTIFIED_PROPERTY = "$is_identified";

    // 逻辑表名，执行器负责映射到物理表
    public static final String EVENTS_TABLE = "events";

    public static final int DEFAULT_LIMIT = 3;
    public static final int DEFAULT_WINDOW_DAYS = 7;

    // 输出列
    public static final String BREAKDOWN_TUPLE = "breakdown_tuple";
    public static final String BREAKDOWN_PROPERTY = "breakdown_property";
    public static final String BREAKDOWN_VALUE = "breakdown_value";
    public static final String COUNT = "count";
    public static final String TOTAL_COUNT = "total_count";
    public static final String ROW_NUMBER = "rn";

    private BreakdownConstants() {}
}
