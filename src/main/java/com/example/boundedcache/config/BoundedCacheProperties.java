package com.example.boundedcache.config;

import com.example.boundedcache.core.CacheConfig;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Cache settings bound from {@code bounded-cache.*}.
 *
 * <pre>{@code
 * bounded-cache:
 *   hard-budget: 8MB
 *   soft-threshold-ratio: 0.8
 *   default-ttl: 5m
 *   category-ttls:
 *     kpis: 5m
 *     ports: 1h
 *   sweep-interval: 30s   # optional, derived from the smallest TTL when absent
 * }</pre>
 */
@ConfigurationProperties(prefix = "bounded-cache")
public record BoundedCacheProperties(
    @DefaultValue("8MB") DataSize hardBudget,
    @DefaultValue("0.8") double softThresholdRatio,
    @DefaultValue("5m") Duration defaultTtl,
    Map<String, Duration> categoryTtls,
    Duration sweepInterval,
    @DefaultValue("PT1M") Duration reportInterval,
    @DefaultValue("COALESCING") RefreshMode refreshMode,
    @DefaultValue("16") int loaderThreads) {

    public BoundedCacheProperties {
        if (categoryTtls == null) {
            categoryTtls = defaultCategoryTtls();
        }
        if (loaderThreads <= 0) {
            throw new IllegalArgumentException(
                "bounded-cache.loader-threads must be positive, got: " + loaderThreads);
        }
    }

    public CacheConfig toCacheConfig() {
        return CacheConfig.builder()
            .hardBudgetBytes(hardBudget.toBytes())
            .softThresholdRatio(softThresholdRatio)
            .defaultTtl(defaultTtl)
            .categoryTtls(categoryTtls)
            .sweepInterval(sweepInterval)
            .build();
    }

    static Map<String, Duration> defaultCategoryTtls() {
        Map<String, Duration> ttls = new LinkedHashMap<>();
        ttls.put("kpis", Duration.ofMinutes(5));
        ttls.put("charts", Duration.ofMinutes(10));
        ttls.put("fleet", Duration.ofMinutes(30));
        ttls.put("inspections", Duration.ofMinutes(5));
        ttls.put("ports", Duration.ofHours(1));
        return ttls;
    }
}
