package com.pricecheck.checker.ratelimit;

import java.time.Duration;

/**
 * At most {@code requests} admissions per sliding {@code window}, with short-term bursts
 * bounded by a token bucket of capacity {@code burst} refilled at {@code requests / window}.
 */
public record RateLimit(int requests, Duration window, int burst) {

    public RateLimit {
        if (requests < 1) {
            throw new IllegalArgumentException("requests must be positive, got " + requests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        if (burst < 1) {
            burst = requests;
        }
    }

    /** Burst capacity equal to {@code requests}. */
    public static RateLimit of(int requests, Duration window) {
        return new RateLimit(requests, window, requests);
    }

    double refillPerSecond() {
        return requests / (window.toNanos() / 1_000_000_000.0);
    }
}
