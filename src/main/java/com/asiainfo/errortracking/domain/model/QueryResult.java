package com.asiainfo.errortracking.domain.model;

import java.util.List;
import java.util.Map;

/**
 * 执行器输出
 *
 * @param rows      扁平结果行，顺序即执行器返回顺序
 * @param queryText 实际执行的 SQL
 * @param timings   执行阶段耗时（毫秒）
 */
public record QueryResult(List<FlatResultRow> rows, String queryText, Map<String, Double> timings) {

    public QueryResult {
        rows = List.copyOf(rows);
    }
}
