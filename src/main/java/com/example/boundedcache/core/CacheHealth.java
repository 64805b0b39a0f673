package com.example.boundedcache.core;

import java.util.ArrayList;
import java.util.List;

public record CacheHealth(Status status, List<String> issues) {

    static final double LOW_HIT_RATE = 0.5;
    static final double HIGH_UTILIZATION = 0.9;

    public enum Status {
        HEALTHY, WARNING, CRITICAL
    }

    public static CacheHealth of(CacheStatistics stats) {
        Status status = Status.HEALTHY;
        List<String> issues = new ArrayList<>();

        if (stats.hits() + stats.misses() > 0 && stats.hitRate() < LOW_HIT_RATE) {
            status = Status.WARNING;
            issues.add("Low cache hit rate");
        }
        if (stats.utilization() > HIGH_UTILIZATION) {
            status = Status.WARNING;
            issues.add("High memory cache utilization");
        }
        if (stats.evictions() > stats.hits()) {
            status = Status.CRITICAL;
            issues.add("Excessive cache evictions");
        }
        return new CacheHealth(status, List.copyOf(issues));
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
