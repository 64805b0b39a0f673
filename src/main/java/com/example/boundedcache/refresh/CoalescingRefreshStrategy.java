package com.example.boundedcache.refresh;

import com.example.boundedcache.core.BoundedCache;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concurrent misses on the same key share a single load. The load runs on a bounded pool
 * so a burst of misses cannot grow threads without limit.
 */
public class CoalescingRefreshStrategy implements RefreshStrategy {

    private static final Logger log = LoggerFactory.getLogger(CoalescingRefreshStrategy.class);

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final ExecutorService asyncExecutor;

    public CoalescingRefreshStrategy(int loaderThreads) {
        if (loaderThreads <= 0) {
            throw new IllegalArgumentException("loader threads must be positive, got: " + loaderThreads);
        }
        this.asyncExecutor = Executors.newFixedThreadPool(loaderThreads);
    }

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

        CompletableFuture<Object> future;
        try {
            future = inFlight.computeIfAbsent(key, k ->
                CompletableFuture.supplyAsync(() -> {
                    Object value = loader.get();
                    if (value == null) {
                        throw new CacheLoadException(key, "Loader returned null for key '" + key + "'");
                    }
                    cache.set(key, value, category);
                    return value;
                }, asyncExecutor));
        } catch (RejectedExecutionException e) {
            throw new CacheLoadException(key, e);
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CacheLoadException loadFailure) {
                throw loadFailure;
            }
            throw new CacheLoadException(key, cause);
        } finally {
            inFlight.remove(key, future);
        }
    }

    int inFlightLoads() {
        return inFlight.size();
    }

    @Override
    public void shutdown() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Cache loaders did not finish within 5s, interrupting {} in-flight loads", inFlight.size());
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
