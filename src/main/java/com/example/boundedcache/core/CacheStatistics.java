package com.example.boundedcache.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time snapshot of a {@link BoundedCache}, taken under the cache lock.
 */
public record CacheStatistics(
    long hits,
    long misses,
    long insertions,
    long evictions,
    long expirations,
    int currentEntryCount,
    long currentSizeBytes,
    long hardBudgetBytes) {

    @JsonProperty("hitRate")
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @JsonProperty("utilization")
    public double utilization() {
        return hardBudgetBytes <= 0 ? 0.0 : (double) currentSizeBytes / hardBudgetBytes;
    }
}
