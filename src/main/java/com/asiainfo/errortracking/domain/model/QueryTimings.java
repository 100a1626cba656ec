package com.asiainfo.errortracking.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 单次请求的分阶段耗时（毫秒），按首次记录顺序保存
 * 同名阶段多次记录时累加
 */
public class QueryTimings {

    private final Map<String, Double> timings = new LinkedHashMap<>();

    public <T> T measure(String key, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(key, System.nanoTime() - start);
        }
    }

    public synchronized void record(String key, long elapsedNanos) {
        timings.merge(key, elapsedNanos / 1_000_000.0, Double::sum);
    }

    public synchronized Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }
}
