package com.asiainfo.errortracking.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 维度名 -> 拆分结果，按维度首次出现的顺序保存，构造后不可变
 */
public final class GroupedBreakdownResult {

    private static final GroupedBreakdownResult EMPTY = new GroupedBreakdownResult(Map.of());

    private final Map<String, DimensionBreakdown> dimensions;

    public GroupedBreakdownResult(Map<String, DimensionBreakdown> dimensions) {
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public static GroupedBreakdownResult empty() {
        return EMPTY;
    }

    public DimensionBreakdown get(String dimension) {
        return dimensions.get(dimension);
    }

    public Set<String> dimensionNames() {
        return dimensions.keySet();
    }

    public int size() {
        return dimensions.size();
    }

    public boolean isEmpty() {
        return dimensions.isEmpty();
    }

    @JsonValue
    public Map<String, DimensionBreakdown> asMap() {
        return dimensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return dimensions.equals(((GroupedBreakdownResult) o).dimensions);
    }

    @Override
    public int hashCode() {
        return dimensions.hashCode();
    }

    @Override
    public String toString() {
        return dimensions.toString();
    }
}
