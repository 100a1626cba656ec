package com.asiainfo.errortracking.infrastructure.cache;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 结果缓存配置
 */
@ApplicationScoped
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @ConfigProperty(name = "breakdowns.cache.enabled", defaultValue = "true")
    boolean enabled = true;

    @ConfigProperty(name = "breakdowns.cache.ttl-seconds", defaultValue = "30")
    int ttlSeconds = 30;

    @ConfigProperty(name = "breakdowns.cache.max-size", defaultValue = "1000")
    int maxSize = 1000;

    @PostConstruct
    void init() {
        log.info("=== Breakdowns Cache Configuration ===");
        log.info("Result cache (Caffeine): {} (TTL: {}s, MaxSize: {})",
                enabled ? "ENABLED" : "DISABLED", ttlSeconds, maxSize);
        log.info("======================================");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
