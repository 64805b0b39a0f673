package com.example.boundedcache.api;

import com.example.boundedcache.backend.MockBackend;
import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheConfig;
import com.example.boundedcache.core.CacheHealth;
import com.example.boundedcache.core.CacheStatistics;
import com.example.boundedcache.refresh.RefreshStrategy;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private final BoundedCache cache;
    private final RefreshStrategy refreshStrategy;
    private final MockBackend backend;

    public CacheController(BoundedCache cache, RefreshStrategy refreshStrategy, MockBackend backend) {
        this.cache = cache;
        this.refreshStrategy = refreshStrategy;
        this.backend = backend;
    }

    @GetMapping("/cache/{key}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String key) {
        return cache.get(key)
            .map(value -> ResponseEntity.ok(Map.of("key", key, "value", value)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/cache/{key}")
    public ResponseEntity<Void> put(
        @PathVariable String key,
        @RequestParam(defaultValue = CacheConfig.DEFAULT_CATEGORY) String category,
        @RequestBody Object value
    ) {
        cache.set(key, value, category);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Void> delete(@PathVariable String key) {
        return cache.remove(key)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @PostMapping("/cache-admin/clear")
    public ResponseEntity<Void> clear() {
        cache.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/cache-admin/stats")
    public CacheStatistics stats() {
        return cache.stats();
    }

    @GetMapping("/cache-admin/health")
    public CacheHealth health() {
        return CacheHealth.of(cache.stats());
    }

    // Read-through: cached value, or fetch from the slow backend and store it
    @GetMapping("/item")
    public Object getItem(
        @RequestParam String key,
        @RequestParam(defaultValue = CacheConfig.DEFAULT_CATEGORY) String category
    ) {
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return refreshStrategy.get(key, category, () -> backend.fetchFromBackend(key), cache);
    }

    @GetMapping("/backend/stats")
    public Map<String, Object> backendStats() {
        return Map.of(
            "backendRequests", backend.getRequestCount(),
            "latencyMillis", backend.getLatencyMillis()
        );
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        backend.resetCount();
        cache.clear();
        return ResponseEntity.noContent().build();
    }
}
