package com.example.boundedcache.refresh;

/**
 * A loader behind a {@link RefreshStrategy} failed; nothing was stored for the key.
 */
public class CacheLoadException extends RuntimeException {

    private final String key;

    public CacheLoadException(String key, String message) {
        super(message);
        this.key = key;
    }

    public CacheLoadException(String key, Throwable cause) {
        super("Failed to load cache key '" + key + "'", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
