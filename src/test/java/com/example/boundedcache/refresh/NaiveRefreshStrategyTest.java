package com.example.boundedcache.refresh;

import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheConfig;
import com.example.boundedcache.support.MutableClock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NaiveRefreshStrategy")
class NaiveRefreshStrategyTest {

    private MutableClock clock;
    private BoundedCache cache;
    private final NaiveRefreshStrategy strategy = new NaiveRefreshStrategy();

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        CacheConfig config = CacheConfig.builder()
            .hardBudgetBytes(10_000)
            .categoryTtl("charts", Duration.ofMinutes(10))
            .build();
        cache = new BoundedCache(config, value -> 10, clock);
    }

    @Test
    @DisplayName("loads on miss, serves from cache afterwards")
    void shouldLoadOnceThenHit() {
        AtomicInteger loads = new AtomicInteger();

        Object first = strategy.get("k", "charts", () -> "v" + loads.incrementAndGet(), cache);
        Object second = strategy.get("k", "charts", () -> "v" + loads.incrementAndGet(), cache);

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(loads).hasValue(1);
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("reloads once the category TTL has passed")
    void shouldReloadAfterExpiry() {
        AtomicInteger loads = new AtomicInteger();
        strategy.get("k", "charts", loads::incrementAndGet, cache);

        clock.advance(Duration.ofMinutes(10));
        Object reloaded = strategy.get("k", "charts", loads::incrementAndGet, cache);

        assertThat(reloaded).isEqualTo(2);
    }

    @Test
    @DisplayName("loader failure is wrapped and nothing is stored")
    void shouldWrapLoaderFailure() {
        assertThatThrownBy(() -> strategy.get("k", "charts", () -> {
            throw new IllegalStateException("backend down");
        }, cache))
            .isInstanceOf(CacheLoadException.class)
            .hasRootCauseMessage("backend down");

        assertThat(cache.stats().currentEntryCount()).isZero();
    }

    @Test
    @DisplayName("null loader result is rejected")
    void shouldRejectNullValue() {
        assertThatThrownBy(() -> strategy.get("k", "charts", () -> null, cache))
            .isInstanceOf(CacheLoadException.class)
            .hasMessageContaining("null");
    }
}
