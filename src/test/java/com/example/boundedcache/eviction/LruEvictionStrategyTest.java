package com.example.boundedcache.eviction;

import com.example.boundedcache.core.CacheEntry;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LruEvictionStrategy")
class LruEvictionStrategyTest {

    private LruEvictionStrategy strategy;
    private Map<String, CacheEntry> store;

    @BeforeEach
    void setUp() {
        strategy = new LruEvictionStrategy();
        store = new HashMap<>();
    }

    private void insert(String key) {
        CacheEntry entry = new CacheEntry(key, key, "default", 1, Long.MAX_VALUE, 0, store.size());
        store.put(key, entry);
        strategy.onInsert(key, entry);
    }

    @Test
    @DisplayName("never-read keys leave in insertion order")
    void shouldEvictInInsertionOrder() {
        insert("a");
        insert("b");

        assertThat(strategy.selectVictim(store)).contains("a");
    }

    @Test
    @DisplayName("a hit moves the key behind the others")
    void shouldProtectRecentlyReadKey() {
        insert("a");
        insert("b");
        insert("c");

        strategy.onHit("a", store.get("a"));

        assertThat(strategy.selectVictim(store)).contains("b");
    }

    @Test
    @DisplayName("keys already gone from the store are skipped and forgotten")
    void shouldSkipStaleKeys() {
        insert("a");
        insert("b");
        store.remove("a");

        assertThat(strategy.selectVictim(store)).contains("b");
        assertThat(strategy.trackedKeys()).isZero();
    }

    @Test
    @DisplayName("removed and cleared keys are not selected")
    void shouldForgetRemovedKeys() {
        insert("a");
        strategy.onRemove("a");
        assertThat(strategy.selectVictim(store)).isEmpty();

        insert("b");
        strategy.clear();
        assertThat(strategy.selectVictim(store)).isEmpty();
    }
}
