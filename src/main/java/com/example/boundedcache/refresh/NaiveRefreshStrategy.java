package com.example.boundedcache.refresh;

import com.example.boundedcache.core.BoundedCache;
import java.util.Optional;
import java.util.function.Supplier;

public class NaiveRefreshStrategy implements RefreshStrategy {

    @Override
    public Object get(
        String key,
        String category,
        Supplier<?> loader,
        BoundedCache cache
    ) {
        Optional<Object> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        Object value;
        try {
            value = loader.get();
        } catch (RuntimeException e) {
            throw new CacheLoadException(key, e);
        }
        if (value == null) {
            throw new CacheLoadException(key, "Loader returned null for key '" + key + "'");
        }

        cache.set(key, value, category);
        return value;
    }
}
