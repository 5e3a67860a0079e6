package com.pricecheck.checker.ratelimit;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/** Mutable per-client state. Only touched while holding the {@link RateLimiter} lock. */
final class ClientRecord {

    final Map<RateLimitClass, Bucket> buckets = new EnumMap<>(RateLimitClass.class);
    Instant blockedUntil;
    Instant lastSeen;

    ClientRecord(Instant now) {
        this.lastSeen = now;
    }

    boolean isBlocked(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }

    Bucket bucket(RateLimitClass limitClass, RateLimit limit, Instant now) {
        return buckets.computeIfAbsent(limitClass, c -> new Bucket(limit.burst(), now));
    }

    static final class Bucket {
        final Deque<Instant> admitted = new ArrayDeque<>();
        double tokens;
        Instant lastRefill;

        Bucket(double tokens, Instant now) {
            this.tokens     = tokens;
            this.lastRefill = now;
        }
    }
}
