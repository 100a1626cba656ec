package com.asiainfo.errortracking.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行器失败（超时、资源上限、生成的计划不合法）
 * 保留已打印的 SQL 和截至失败时的耗时，便于排查
 */
public class QueryExecutionException extends BreakdownsException {

    private final String queryText;
    private final Map<String, Double> timings;

    public QueryExecutionException(String message, String queryText, Map<String, Double> timings, Throwable cause) {
        super(message, cause);
        this.queryText = queryText;
        this.timings = timings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }

    public String getQueryText() {
        return queryText;
    }

    public Map<String, Double> getTimings() {
        return timings;
    }

    @Override
    public String getStatusCode() {
        return "9999";
    }
}
