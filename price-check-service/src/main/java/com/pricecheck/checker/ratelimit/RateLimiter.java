package com.pricecheck.checker.ratelimit;

import com.pricecheck.checker.ratelimit.ClientRecord.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Per-client admission control combining a sliding window and a token bucket.
 *
 * <p>A request is admitted only when both agree: fewer than {@code requests} admissions in
 * the trailing window, and at least one whole token in the bucket. Buckets start full. On
 * rejection {@code retryAfter} is the longer wait among the mechanisms that refused. An
 * explicit block refuses everything until it lapses.
 *
 * <p>Every limit class keeps its own window and bucket per client. All state sits behind
 * one lock.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<RateLimitClass, RateLimit> limits;
    private final Clock clock;
    private final Map<String, ClientRecord> clients = new HashMap<>();

    public RateLimiter(Map<RateLimitClass, RateLimit> limits, Clock clock) {
        for (RateLimitClass limitClass : RateLimitClass.values()) {
            if (!limits.containsKey(limitClass)) {
                throw new IllegalArgumentException("No rate limit configured for " + limitClass);
            }
        }
        this.limits = new EnumMap<>(limits);
        this.clock  = clock;
    }

    public static Map<RateLimitClass, RateLimit> defaultLimits() {
        Map<RateLimitClass, RateLimit> defaults = new EnumMap<>(RateLimitClass.class);
        defaults.put(RateLimitClass.GLOBAL, new RateLimit(100, Duration.ofSeconds(60), 10));
        defaults.put(RateLimitClass.CHECK,  new RateLimit(20,  Duration.ofSeconds(60), 5));
        defaults.put(RateLimitClass.HEAVY,  new RateLimit(5,   Duration.ofSeconds(60), 2));
        defaults.put(RateLimitClass.ADMIN,  new RateLimit(200, Duration.ofSeconds(60), 20));
        return defaults;
    }

    public RateLimit limitFor(RateLimitClass limitClass) {
        return limits.get(limitClass);
    }

    public synchronized RateLimitDecision checkRateLimit(String clientId, RateLimitClass limitClass) {
        RateLimit limit = limits.get(limitClass);
        Instant now = clock.instant();
        ClientRecord client = clients.computeIfAbsent(clientId, id -> new ClientRecord(now));
        client.lastSeen = now;

        if (client.isBlocked(now)) {
            Duration remainingBlock = Duration.between(now, client.blockedUntil);
            log.warn("RATE_LIMITED client={} class={} reason=blocked retryAfterMs={}",
                clientId, limitClass, remainingBlock.toMillis());
            return RateLimitDecision.reject(limit, remainingBlock);
        }
        client.blockedUntil = null;

        Bucket bucket = client.bucket(limitClass, limit, now);
        pruneWindow(bucket, limit, now);
        refill(bucket, limit, now);

        Duration retryAfter = Duration.ZERO;
        boolean rejected = false;

        if (bucket.admitted.size() >= limit.requests()) {
            Duration untilOldestExpires = Duration.between(now, bucket.admitted.peekFirst().plus(limit.window()));
            retryAfter = max(retryAfter, untilOldestExpires);
            rejected = true;
        }
        if (bucket.tokens < 1.0) {
            double secondsToToken = (1.0 - bucket.tokens) / limit.refillPerSecond();
            retryAfter = max(retryAfter, Duration.ofNanos((long) Math.ceil(secondsToToken * 1_000_000_000L)));
            rejected = true;
        }

        if (rejected) {
            log.warn("RATE_LIMITED client={} class={} inWindow={} tokens={} retryAfterMs={}",
                clientId, limitClass, bucket.admitted.size(), String.format("%.2f", bucket.tokens),
                retryAfter.toMillis());
            return RateLimitDecision.reject(limit, retryAfter);
        }

        bucket.admitted.addLast(now);
        bucket.tokens -= 1.0;
        int remaining = Math.max(0, Math.min(limit.requests() - bucket.admitted.size(), (int) Math.floor(bucket.tokens)));
        return RateLimitDecision.allow(limit, remaining);
    }

    public synchronized void blockClient(String clientId, Duration duration) {
        Instant now = clock.instant();
        ClientRecord client = clients.computeIfAbsent(clientId, id -> new ClientRecord(now));
        client.blockedUntil = now.plus(duration);
        log.warn("CLIENT_BLOCKED client={} durationSeconds={} blockedUntil={}",
            clientId, duration.toSeconds(), client.blockedUntil);
    }

    /** @return {@code false} when the client had no active block */
    public synchronized boolean unblockClient(String clientId) {
        ClientRecord client = clients.get(clientId);
        if (client == null || !client.isBlocked(clock.instant())) {
            return false;
        }
        client.blockedUntil = null;
        log.info("CLIENT_UNBLOCKED client={}", clientId);
        return true;
    }

    public synchronized Optional<ClientStats> clientStats(String clientId) {
        ClientRecord client = clients.get(clientId);
        if (client == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Map<RateLimitClass, ClientStats.ClassUsage> usage = new EnumMap<>(RateLimitClass.class);
        client.buckets.forEach((limitClass, bucket) -> {
            RateLimit limit = limits.get(limitClass);
            pruneWindow(bucket, limit, now);
            refill(bucket, limit, now);
            usage.put(limitClass, new ClientStats.ClassUsage(bucket.admitted.size(), limit.requests(),
                bucket.tokens, limit.burst()));
        });
        boolean blocked = client.isBlocked(now);
        return Optional.of(new ClientStats(clientId, blocked, blocked ? client.blockedUntil : null,
            client.lastSeen, usage));
    }

    /**
     * Drops clients idle for longer than {@code maxAge}. Clients under an active block are kept.
     *
     * @return number of records removed
     */
    public synchronized int cleanupExpiredClients(Duration maxAge) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(maxAge);
        int removed = 0;
        Iterator<ClientRecord> it = clients.values().iterator();
        while (it.hasNext()) {
            ClientRecord client = it.next();
            if (client.lastSeen.isBefore(cutoff) && !client.isBlocked(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("RATE_LIMIT_CLEANUP removed={} remaining={}", removed, clients.size());
        }
        return removed;
    }

    public synchronized int clientCount() {
        return clients.size();
    }

    // ── caller holds lock ───────────────────────────────────────────────────

    private static void pruneWindow(Bucket bucket, RateLimit limit, Instant now) {
        Instant windowStart = now.minus(limit.window());
        while (!bucket.admitted.isEmpty() && !bucket.admitted.peekFirst().isAfter(windowStart)) {
            bucket.admitted.pollFirst();
        }
    }

    private static void refill(Bucket bucket, RateLimit limit, Instant now) {
        double elapsedSeconds = Duration.between(bucket.lastRefill, now).toNanos() / 1_000_000_000.0;
        if (elapsedSeconds > 0) {
            bucket.tokens = Math.min(limit.burst(), bucket.tokens + elapsedSeconds * limit.refillPerSecond());
            bucket.lastRefill = now;
        }
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
