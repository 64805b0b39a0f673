package com.example.boundedcache.size;

/**
 * Approximate retained size of a cached value, computed once at insertion.
 *
 * <p>Exactness is not required; the estimate only has to grow with the payload.
 */
@FunctionalInterface
public interface SizeEstimator {
    long estimateSize(Object value);
}
