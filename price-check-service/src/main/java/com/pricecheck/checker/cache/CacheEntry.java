package com.pricecheck.checker.cache;

import java.time.Instant;

/**
 * Immutable cache entry. {@code value} may be {@code null} or an empty collection; both are
 * valid cached states.
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant storedAt,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt) || now.equals(expiresAt);
    }
}
