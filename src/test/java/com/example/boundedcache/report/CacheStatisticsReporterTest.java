package com.example.boundedcache.report;

import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("CacheStatisticsReporter")
class CacheStatisticsReporterTest {

    private BoundedCache cache;
    private CacheStatisticsReporter reporter;

    @BeforeEach
    void setUp() {
        cache = mock(BoundedCache.class);
        reporter = new CacheStatisticsReporter(cache);
    }

    @Test
    @DisplayName("healthy stats are logged without a health warning")
    void shouldLogHealthyStatsWithoutWarning(CapturedOutput output) {
        given(cache.stats()).willReturn(new CacheStatistics(9, 1, 5, 0, 0, 5, 500, 1000));

        reporter.report();

        assertThat(output.getOut()).contains("[Cache] entries=5, size=500/1000 bytes");
        assertThat(output.getOut()).doesNotContain("[Cache] health");
        verify(cache, times(1)).stats();
    }

    @Test
    @DisplayName("unhealthy stats add a warning line with the issues")
    void shouldWarnOnUnhealthyStats(CapturedOutput output) {
        given(cache.stats()).willReturn(new CacheStatistics(1, 5, 6, 9, 0, 1, 990, 1000));

        reporter.report();

        assertThat(output.getOut())
            .contains("WARN")
            .contains("[Cache] health CRITICAL")
            .contains("Excessive cache evictions")
            .contains("High memory cache utilization");
    }
}
