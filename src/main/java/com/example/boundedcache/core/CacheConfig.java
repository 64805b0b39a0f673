package com.example.boundedcache.core;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings of a {@link BoundedCache}, validated once at {@link Builder#build()}.
 *
 * <p>When no sweep interval is given, it is derived from the smallest configured TTL and
 * clamped to {@link #MIN_SWEEP_INTERVAL}.
 */
public final class CacheConfig {

    public static final String DEFAULT_CATEGORY = "default";
    public static final double DEFAULT_SOFT_THRESHOLD_RATIO = 0.8;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final Duration MIN_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final long hardBudgetBytes;
    private final double softThresholdRatio;
    private final Map<String, Duration> categoryTtls;
    private final Duration defaultTtl;
    private final Duration sweepInterval;

    private CacheConfig(Builder builder) {
        this.hardBudgetBytes = builder.hardBudgetBytes;
        this.softThresholdRatio = builder.softThresholdRatio;
        this.categoryTtls = Collections.unmodifiableMap(new LinkedHashMap<>(builder.categoryTtls));
        this.defaultTtl = builder.defaultTtl;
        this.sweepInterval = builder.sweepInterval != null
            ? builder.sweepInterval
            : deriveSweepInterval(categoryTtls, defaultTtl);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration ttlFor(String category) {
        if (category == null) {
            return defaultTtl;
        }
        return categoryTtls.getOrDefault(category, defaultTtl);
    }

    public String resolveCategory(String category) {
        return category != null && categoryTtls.containsKey(category) ? category : DEFAULT_CATEGORY;
    }

    public long softThresholdBytes() {
        return (long) Math.floor(hardBudgetBytes * softThresholdRatio);
    }

    public long getHardBudgetBytes() {
        return hardBudgetBytes;
    }

    public double getSoftThresholdRatio() {
        return softThresholdRatio;
    }

    public Map<String, Duration> getCategoryTtls() {
        return categoryTtls;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    private static Duration deriveSweepInterval(Map<String, Duration> ttls, Duration defaultTtl) {
        Duration smallest = defaultTtl;
        for (Duration ttl : ttls.values()) {
            if (ttl.compareTo(smallest) < 0) {
                smallest = ttl;
            }
        }
        return smallest.compareTo(MIN_SWEEP_INTERVAL) < 0 ? MIN_SWEEP_INTERVAL : smallest;
    }

    @Override
    public String toString() {
        return "CacheConfig{hardBudgetBytes=" + hardBudgetBytes
            + ", softThresholdRatio=" + softThresholdRatio
            + ", categoryTtls=" + categoryTtls
            + ", defaultTtl=" + defaultTtl
            + ", sweepInterval=" + sweepInterval + '}';
    }

    public static final class Builder {

        private long hardBudgetBytes;
        private double softThresholdRatio = DEFAULT_SOFT_THRESHOLD_RATIO;
        private final Map<String, Duration> categoryTtls = new LinkedHashMap<>();
        private Duration defaultTtl = DEFAULT_TTL;
        private Duration sweepInterval;

        private Builder() {
        }

        public Builder hardBudgetBytes(long hardBudgetBytes) {
            this.hardBudgetBytes = hardBudgetBytes;
            return this;
        }

        public Builder softThresholdRatio(double softThresholdRatio) {
            this.softThresholdRatio = softThresholdRatio;
            return this;
        }

        public Builder categoryTtl(String category, Duration ttl) {
            this.categoryTtls.put(category, ttl);
            return this;
        }

        public Builder categoryTtls(Map<String, Duration> ttls) {
            ttls.forEach(this::categoryTtl);
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public CacheConfig build() {
            if (hardBudgetBytes <= 0) {
                throw new IllegalArgumentException("hard budget must be positive, got: " + hardBudgetBytes);
            }
            if (!(softThresholdRatio > 0.0 && softThresholdRatio <= 1.0)) {
                throw new IllegalArgumentException("soft threshold ratio must be in (0, 1], got: " + softThresholdRatio);
            }
            requirePositive("default TTL", defaultTtl);
            categoryTtls.forEach((category, ttl) -> {
                if (category == null || category.isBlank()) {
                    throw new IllegalArgumentException("category name must not be blank");
                }
                requirePositive("TTL of category '" + category + "'", ttl);
            });
            if (sweepInterval != null) {
                requirePositive("sweep interval", sweepInterval);
            }
            return new CacheConfig(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
            try {
                value.toMillis();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(name + " does not fit in milliseconds, got: " + value, e);
            }
        }
    }
}
