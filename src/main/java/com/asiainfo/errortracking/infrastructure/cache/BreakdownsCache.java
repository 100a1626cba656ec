package com.asiainfo.errortracking.infrastructure.cache;

import com.asiainfo.errortracking.application.engine.BreakdownsResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 拆分查询结果的 Caffeine 内存缓存
 */
@ApplicationScoped
public class BreakdownsCache {

    private static final Logger log = LoggerFactory.getLogger(BreakdownsCache.class);

    @Inject
    CacheConfig config;

    @Inject
    MeterRegistry registry;

    private Cache<String, BreakdownsResponse> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getMaxSize())
                .build();

        log.info("[Breakdowns Cache] Initialized with TTL={}s, MaxSize={}",
                config.getTtlSeconds(), config.getMaxSize());
    }

    public BreakdownsResponse get(BreakdownsCacheKey key) {
        if (!config.isEnabled()) {
            return null;
        }
        BreakdownsResponse value = cache.getIfPresent(key.toL1Key());
        if (value != null) {
            log.debug("[Breakdowns Cache] Hit: {}", key);
            registry.counter("breakdowns.cache.hits").increment();
            return value;
        }
        log.debug("[Breakdowns Cache] Miss: {}", key);
        return null;
    }

    public void put(BreakdownsCacheKey key, BreakdownsResponse value) {
        if (!config.isEnabled()) {
            return;
        }
        cache.put(key.toL1Key(), value);
        log.debug("[Breakdowns Cache] Put: {}", key);
    }
}
