package com.example.boundedcache.core;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheConfig")
class CacheConfigTest {

    @Test
    @DisplayName("category TTL lookup falls back to the default TTL")
    void shouldResolveTtlPerCategory() {
        CacheConfig config = CacheConfig.builder()
            .hardBudgetBytes(1_000)
            .categoryTtl("charts", Duration.ofMinutes(10))
            .defaultTtl(Duration.ofMinutes(2))
            .build();

        assertThat(config.ttlFor("charts")).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.ttlFor("unknown")).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.ttlFor(null)).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.resolveCategory("charts")).isEqualTo("charts");
        assertThat(config.resolveCategory("unknown")).isEqualTo(CacheConfig.DEFAULT_CATEGORY);
    }

    @Test
    @DisplayName("sweep interval defaults to the smallest TTL")
    void shouldDeriveSweepIntervalFromSmallestTtl() {
        CacheConfig config = CacheConfig.builder()
            .hardBudgetBytes(1_000)
            .categoryTtl("kpis", Duration.ofMinutes(5))
            .categoryTtl("live", Duration.ofSeconds(20))
            .build();

        assertThat(config.getSweepInterval()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("derived sweep interval is never below one second")
    void shouldClampDerivedSweepInterval() {
        CacheConfig config = CacheConfig.builder()
            .hardBudgetBytes(1_000)
            .categoryTtl("short", Duration.ofMillis(100))
            .build();

        assertThat(config.getSweepInterval()).isEqualTo(CacheConfig.MIN_SWEEP_INTERVAL);
    }

    @Test
    @DisplayName("soft threshold is 80% of the hard budget by default")
    void shouldComputeSoftThreshold() {
        CacheConfig config = CacheConfig.builder().hardBudgetBytes(300).build();

        assertThat(config.softThresholdBytes()).isEqualTo(240);
        assertThat(config.getCategoryTtls()).isEmpty();
    }

    @Test
    @DisplayName("non-positive budget is rejected")
    void shouldRejectNonPositiveBudget() {
        assertThatThrownBy(() -> CacheConfig.builder().hardBudgetBytes(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hard budget");
    }

    @Test
    @DisplayName("non-positive sweep interval and TTLs are rejected")
    void shouldRejectNonPositiveDurations() {
        assertThatThrownBy(() -> CacheConfig.builder()
            .hardBudgetBytes(10).sweepInterval(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sweep interval");
        assertThatThrownBy(() -> CacheConfig.builder()
            .hardBudgetBytes(10).categoryTtl("x", Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'x'");
        assertThatThrownBy(() -> CacheConfig.builder()
            .hardBudgetBytes(10).defaultTtl(null).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("soft threshold ratio must be in (0, 1]")
    void shouldRejectInvalidRatio() {
        assertThatThrownBy(() -> CacheConfig.builder().hardBudgetBytes(10).softThresholdRatio(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheConfig.builder().hardBudgetBytes(10).softThresholdRatio(1.5).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
