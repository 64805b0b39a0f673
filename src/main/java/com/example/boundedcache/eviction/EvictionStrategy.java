package com.example.boundedcache.eviction;

import com.example.boundedcache.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which entry leaves the store when it is over budget.
 *
 * <p>Implementations are not thread-safe; {@code BoundedCache} calls them only while
 * holding its lock.
 */
public interface EvictionStrategy {
    void onInsert(String key, CacheEntry entry);
    void onHit(String key, CacheEntry entry);
    void onRemove(String key);
    Optional<String> selectVictim(Map<String, CacheEntry> store);
    void clear();
}
