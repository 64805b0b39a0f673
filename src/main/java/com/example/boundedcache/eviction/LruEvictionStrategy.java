package com.example.boundedcache.eviction;

import com.example.boundedcache.core.CacheEntry;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used order kept in an access-ordered {@link LinkedHashMap}.
 *
 * <p>The head is the key with the oldest {@code lastAccessedAt}. Keys with equal timestamps
 * keep the order in which they were touched, which for never-read keys is insertion order.
 */
public class LruEvictionStrategy implements EvictionStrategy {

    // LinkedHashMap in access-order mode: accessOrder = true
    private final LinkedHashMap<String, Boolean> order =
        new LinkedHashMap<>(16, 0.75f, true);

    @Override
    public void onInsert(String key, CacheEntry entry) {
        // replacing a key counts as an access and moves it to the tail
        order.put(key, Boolean.TRUE);
    }

    @Override
    public void onHit(String key, CacheEntry entry) {
        order.get(key);
    }

    @Override
    public void onRemove(String key) {
        order.remove(key);
    }

    @Override
    public Optional<String> selectVictim(Map<String, CacheEntry> store) {
        Iterator<Map.Entry<String, Boolean>> it = order.entrySet().iterator();
        while (it.hasNext()) {
            String candidateKey = it.next().getKey();
            it.remove();
            // candidate may already be gone from the store
            if (store.containsKey(candidateKey)) {
                return Optional.of(candidateKey);
            }
        }
        return Optional.empty();
    }

    @Override
    public void clear() {
        order.clear();
    }

    int trackedKeys() {
        return order.size();
    }
}
