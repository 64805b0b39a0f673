package com.example.boundedcache.core;

import com.example.boundedcache.eviction.EvictionStrategy;
import com.example.boundedcache.eviction.LruEvictionStrategy;
import com.example.boundedcache.size.JsonSizeEstimator;
import com.example.boundedcache.size.SizeEstimator;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * In-process cache bounded by an approximate memory budget.
 *
 * <p>Entries expire per category TTL. Expiry is checked lazily on {@link #get(String)} and
 * by a periodic sweep scheduled on the {@link TaskScheduler} given at construction. After
 * every {@link #set(String, Object, String)} the store is brought back under the hard
 * budget by evicting least-recently-used entries down to the soft threshold.
 *
 * <p>A single lock guards the entry map, the eviction order and all counters, so each
 * operation and each {@link #stats()} snapshot is atomic with respect to the others.
 */
public class BoundedCache {

    private static final Logger log = LoggerFactory.getLogger(BoundedCache.class);

    private static final Comparator<CacheEntry> LEAST_RECENTLY_USED =
        Comparator.comparingLong(CacheEntry::getLastAccessedAt)
            .thenComparingLong(CacheEntry::getInsertionOrder);

    private final CacheConfig config;
    private final SizeEstimator sizeEstimator;
    private final EvictionStrategy evictionStrategy;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> store = new HashMap<>();

    private long currentSizeBytes;
    private long insertionSequence;
    private long hits;
    private long misses;
    private long insertions;
    private long evictions;
    private long expirations;

    private ScheduledFuture<?> sweepTask;

    public BoundedCache(CacheConfig config) {
        this(config, new JsonSizeEstimator(), new LruEvictionStrategy(), Clock.systemUTC(), null);
    }

    public BoundedCache(CacheConfig config, SizeEstimator sizeEstimator, Clock clock) {
        this(config, sizeEstimator, new LruEvictionStrategy(), clock, null);
    }

    public BoundedCache(
        CacheConfig config,
        SizeEstimator sizeEstimator,
        EvictionStrategy evictionStrategy,
        Clock clock,
        TaskScheduler scheduler
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "sizeEstimator");
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy, "evictionStrategy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;
    }

    public void set(String key, Object value, String category) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("cache key must not be empty");
        }
        Objects.requireNonNull(value, "value");

        // estimate outside the lock, it may serialize a large payload
        long sizeBytes = clampSize(sizeEstimator.estimateSize(value));
        String resolvedCategory = config.resolveCategory(category);
        long ttlMillis = config.ttlFor(category).toMillis();

        lock.lock();
        try {
            long now = clock.millis();
            removeEntry(key);

            CacheEntry entry = new CacheEntry(
                key, value, resolvedCategory, sizeBytes, expiryOf(now, ttlMillis), now, insertionSequence++);
            store.put(key, entry);
            addSize(sizeBytes);
            insertions++;
            evictionStrategy.onInsert(key, entry);

            enforceBudget(now);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Object> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = key == null ? null : store.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }

            long now = clock.millis();
            if (entry.isExpired(now)) {
                removeEntry(key);
                expirations++;
                misses++;
                return Optional.empty();
            }

            entry.touch(now);
            evictionStrategy.onHit(key, entry);
            hits++;
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a key explicitly. Not counted as an eviction.
     */
    public boolean remove(String key) {
        lock.lock();
        try {
            return key != null && removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry. Cumulative counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            int cleared = store.size();
            store.clear();
            evictionStrategy.clear();
            currentSizeBytes = 0;
            if (cleared > 0) {
                log.info("Cleared {} cache entries", cleared);
            }
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics stats() {
        lock.lock();
        try {
            return new CacheStatistics(
                hits, misses, insertions, evictions, expirations,
                store.size(), currentSizeBytes, config.getHardBudgetBytes());
        } finally {
            lock.unlock();
        }
    }

    /**
     * One sweep pass: removes every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        lock.lock();
        try {
            int removed = removeExpired(clock.millis());
            if (removed > 0) {
                log.debug("Swept {} expired cache entries, {} remain", removed, store.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schedules the periodic sweep. Does nothing when no scheduler was supplied or the
     * sweep is already running.
     */
    public void start() {
        lock.lock();
        try {
            if (scheduler == null) {
                log.info("No scheduler configured, expired entries are removed on read only");
                return;
            }
            if (sweepTask != null) {
                return;
            }
            sweepTask = scheduler.scheduleWithFixedDelay(
                this::sweepExpired,
                clock.instant().plus(config.getSweepInterval()),
                config.getSweepInterval());
            log.info("Started cache sweep every {} ({})", config.getSweepInterval(), config);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the periodic sweep. A pass that is already running completes first.
     */
    public void shutdown() {
        ScheduledFuture<?> task;
        lock.lock();
        try {
            task = sweepTask;
            sweepTask = null;
        } finally {
            lock.unlock();
        }
        if (task != null) {
            task.cancel(false);
            log.info("Stopped cache sweep");
        }
    }

    public boolean isSweepRunning() {
        lock.lock();
        try {
            return sweepTask != null && !sweepTask.isCancelled();
        } finally {
            lock.unlock();
        }
    }

    public CacheConfig getConfig() {
        return config;
    }

    private void enforceBudget(long now) {
        long hardBudget = config.getHardBudgetBytes();
        if (currentSizeBytes <= hardBudget) {
            return;
        }

        // expired entries are logically absent, drop them before touching live ones
        removeExpired(now);
        if (currentSizeBytes <= hardBudget) {
            return;
        }

        long target = config.softThresholdBytes();
        int evicted = 0;
        while (currentSizeBytes > target && !store.isEmpty()) {
            String victim = evictionStrategy.selectVictim(store)
                .filter(store::containsKey)
                .orElseGet(this::leastRecentlyUsedByScan);
            removeEntry(victim);
            evictions++;
            evicted++;
        }
        log.debug("Evicted {} entries, size now {} of {} bytes", evicted, currentSizeBytes, hardBudget);
    }

    private String leastRecentlyUsedByScan() {
        log.warn("Eviction order lost track of {} entries, selecting victim by scan", store.size());
        return store.values().stream()
            .min(LEAST_RECENTLY_USED)
            .map(CacheEntry::getKey)
            .orElseThrow();
    }

    private int removeExpired(long now) {
        int removed = 0;
        Iterator<CacheEntry> it = store.values().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next();
            if (entry.isExpired(now)) {
                it.remove();
                evictionStrategy.onRemove(entry.getKey());
                subtractSize(entry.getSizeBytes());
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }

    private CacheEntry removeEntry(String key) {
        CacheEntry removed = store.remove(key);
        if (removed != null) {
            evictionStrategy.onRemove(key);
            subtractSize(removed.getSizeBytes());
        }
        return removed;
    }

    // Caps an estimate so that adding it to a store within budget cannot overflow
    private long clampSize(long estimate) {
        return Math.min(Math.max(0L, estimate), Long.MAX_VALUE - config.getHardBudgetBytes());
    }

    private static long expiryOf(long now, long ttlMillis) {
        return ttlMillis >= Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
    }

    private void addSize(long sizeBytes) {
        currentSizeBytes += sizeBytes;
        if (currentSizeBytes < 0) {
            repairSize();
        }
    }

    private void subtractSize(long sizeBytes) {
        currentSizeBytes -= sizeBytes;
        if (currentSizeBytes < 0) {
            repairSize();
        }
    }

    private void repairSize() {
        long recomputed = 0;
        for (CacheEntry entry : store.values()) {
            recomputed = recomputed > Long.MAX_VALUE - entry.getSizeBytes()
                ? Long.MAX_VALUE
                : recomputed + entry.getSizeBytes();
        }
        log.warn("Cache size accounting went negative ({}), reset to {} from a full scan",
            currentSizeBytes, recomputed);
        currentSizeBytes = recomputed;
    }
}
