package com.example.boundedcache.core;

public class CacheEntry {

    private final String key;
    private final Object value;
    private final String category;
    private final long sizeBytes;
    private final long expiresAt;       // absolute timestamp in millis when TTL expires
    private final long insertionOrder;  // tie breaker for entries never read
    private long lastAccessedAt;        // LRU ordering key, only ever moves forward

    public CacheEntry(String key, Object value, String category, long sizeBytes,
                      long expiresAt, long now, long insertionOrder) {
        this.key = key;
        this.value = value;
        this.category = category;
        this.sizeBytes = Math.max(0L, sizeBytes);
        this.expiresAt = expiresAt;
        this.lastAccessedAt = now;
        this.insertionOrder = insertionOrder;
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }

    void touch(long now) {
        if (now > lastAccessedAt) {
            lastAccessedAt = now;
        }
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    public String getCategory() {
        return category;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    public long getInsertionOrder() {
        return insertionOrder;
    }
}
