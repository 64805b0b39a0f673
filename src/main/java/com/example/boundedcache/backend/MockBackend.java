package com.example.boundedcache.backend;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stands in for an expensive remote fetch behind the read-through endpoint.
 */
@Component
public class MockBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private volatile long latencyMillis;

    public MockBackend(@Value("${backend.latency:500ms}") Duration latency) {
        this.latencyMillis = latency.toMillis();
    }

    // Simulates a slow backend fetch
    public Map<String, Object> fetchFromBackend(String key) {
        requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching " + key, e);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("value", "value-for-" + key);
        payload.put("fetchedAt", System.currentTimeMillis());
        return payload;
    }

    public void setLatencyMillis(long ms) {
        if (ms < 0) {
            throw new IllegalArgumentException("latency must not be negative, got: " + ms);
        }
        this.latencyMillis = ms;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
