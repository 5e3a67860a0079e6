package com.pricecheck.checker.ratelimit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admission verdict for one request. {@code retryAfter} is zero when allowed.
 */
public record RateLimitDecision(
    boolean allowed,
    int limit,
    long windowSeconds,
    int remaining,
    Duration retryAfter
) {

    public static final String HEADER_LIMIT       = "X-RateLimit-Limit";
    public static final String HEADER_WINDOW      = "X-RateLimit-Window";
    public static final String HEADER_REMAINING   = "X-RateLimit-Remaining";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public static RateLimitDecision allow(RateLimit limit, int remaining) {
        return new RateLimitDecision(true, limit.requests(), limit.window().toSeconds(), remaining, Duration.ZERO);
    }

    public static RateLimitDecision reject(RateLimit limit, Duration retryAfter) {
        return new RateLimitDecision(false, limit.requests(), limit.window().toSeconds(), 0, retryAfter);
    }

    /** Whole seconds to wait, rounded up, never below one. */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_LIMIT, String.valueOf(limit));
        headers.put(HEADER_WINDOW, String.valueOf(windowSeconds));
        headers.put(HEADER_REMAINING, String.valueOf(remaining));
        if (!allowed) {
            headers.put(HEADER_RETRY_AFTER, String.valueOf(retryAfterSeconds()));
        }
        return headers;
    }
}
