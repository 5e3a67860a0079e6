package com.pricecheck.checker.client;

import java.time.Duration;

/**
 * @param maxRetries     total attempts per logical call
 * @param backoffFactor  base of the exponential backoff; the wait after failed attempt
 *                       {@code n} (0-based) is {@code 2^n * backoffFactor}
 * @param requestTimeout per-attempt timeout
 */
public record RetrySettings(int maxRetries, Duration backoffFactor, Duration requestTimeout) {

    public static final RetrySettings DEFAULTS =
        new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(4));

    public RetrySettings {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
    }

    public Duration backoffAfter(int zeroBasedAttempt) {
        return backoffFactor.multipliedBy(1L << zeroBasedAttempt);
    }
}
