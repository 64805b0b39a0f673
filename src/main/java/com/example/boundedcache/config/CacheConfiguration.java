package com.example.boundedcache.config;

import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheConfig;
import com.example.boundedcache.eviction.LruEvictionStrategy;
import com.example.boundedcache.refresh.CoalescingRefreshStrategy;
import com.example.boundedcache.refresh.NaiveRefreshStrategy;
import com.example.boundedcache.refresh.RefreshStrategy;
import com.example.boundedcache.size.JsonSizeEstimator;
import com.example.boundedcache.size.SizeEstimator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the process-wide {@link BoundedCache}.
 *
 * <p>The sweep and the statistics report share one small scheduler pool. The cache bean is
 * started after construction and its sweep cancelled before the scheduler shuts down.
 */
@Configuration
@EnableConfigurationProperties(BoundedCacheProperties.class)
public class CacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CacheConfiguration.class);

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("cache-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SizeEstimator sizeEstimator(ObjectMapper objectMapper) {
        return new JsonSizeEstimator(objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public BoundedCache boundedCache(
        BoundedCacheProperties properties,
        SizeEstimator sizeEstimator,
        Clock cacheClock,
        ThreadPoolTaskScheduler taskScheduler
    ) {
        CacheConfig config = properties.toCacheConfig();
        log.info("Creating bounded cache: {}", config);
        return new BoundedCache(config, sizeEstimator, new LruEvictionStrategy(), cacheClock, taskScheduler);
    }

    @Bean(destroyMethod = "shutdown")
    public RefreshStrategy refreshStrategy(BoundedCacheProperties properties) {
        switch (properties.refreshMode()) {
            case NAIVE:
                return new NaiveRefreshStrategy();
            case COALESCING:
                return new CoalescingRefreshStrategy(properties.loaderThreads());
            default:
                throw new IllegalArgumentException("Unknown refresh mode: " + properties.refreshMode());
        }
    }
}
