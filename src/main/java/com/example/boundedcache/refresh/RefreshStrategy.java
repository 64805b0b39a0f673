package com.example.boundedcache.refresh;

import com.example.boundedcache.core.BoundedCache;
import java.util.function.Supplier;

/**
 * Check-then-recompute-then-store: returns the cached value for {@code key}, or runs
 * {@code loader}, stores its result under {@code category} and returns it.
 */
public interface RefreshStrategy {
    Object get(
        String key,
        String category,
        Supplier<?> loader,
        BoundedCache cache
    );

    default void shutdown() {
    }
}
