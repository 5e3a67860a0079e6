package com.pricecheck.checker.cache;

import java.time.Instant;

/**
 * Result of a cache lookup with an explicit hit signal, so a cached {@code null} or empty
 * list can be told apart from a miss.
 */
public record CacheLookup<V>(boolean hit, V value, Instant storedAt) {

    private static final CacheLookup<?> MISS = new CacheLookup<>(false, null, null);

    @SuppressWarnings("unchecked")
    public static <V> CacheLookup<V> miss() {
        return (CacheLookup<V>) MISS;
    }

    public static <V> CacheLookup<V> hit(CacheEntry<V> entry) {
        return new CacheLookup<>(true, entry.value(), entry.storedAt());
    }
}
