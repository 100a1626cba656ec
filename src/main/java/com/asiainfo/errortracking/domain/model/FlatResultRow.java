package com.asiainfo.errortracking.domain.model;

/**
 * 执行器返回的一行：(维度, 值, 计数, 该维度总数)
 */
public record FlatResultRow(String dimensionName, String dimensionValue, long count, long totalCountForDimension) {
}
