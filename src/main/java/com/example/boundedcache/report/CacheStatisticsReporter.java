package com.example.boundedcache.report;

import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheHealth;
import com.example.boundedcache.core.CacheStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically exports the cache statistics to the log stream.
 */
@Component
public class CacheStatisticsReporter {

    private static final Logger log = LoggerFactory.getLogger(CacheStatisticsReporter.class);

    private final BoundedCache cache;

    public CacheStatisticsReporter(BoundedCache cache) {
        this.cache = cache;
    }

    @Scheduled(
        initialDelayString = "${bounded-cache.report-interval:PT1M}",
        fixedDelayString = "${bounded-cache.report-interval:PT1M}")
    public void report() {
        CacheStatistics stats = cache.stats();
        log.info("[Cache] entries={}, size={}/{} bytes ({}%), hits={}, misses={}, hitRate={}%, "
                + "insertions={}, evictions={}, expirations={}",
            stats.currentEntryCount(),
            stats.currentSizeBytes(),
            stats.hardBudgetBytes(),
            String.format("%.1f", stats.utilization() * 100),
            stats.hits(),
            stats.misses(),
            String.format("%.1f", stats.hitRate() * 100),
            stats.insertions(),
            stats.evictions(),
            stats.expirations());

        CacheHealth health = CacheHealth.of(stats);
        if (!health.isHealthy()) {
            log.warn("[Cache] health {}: {}", health.status(), health.issues());
        }
    }
}
