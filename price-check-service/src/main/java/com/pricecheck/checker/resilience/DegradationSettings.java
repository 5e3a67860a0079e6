package com.pricecheck.checker.resilience;

import java.time.Duration;

/**
 * @param sourceTimeout  default per-source bound on a primary call
 * @param freshness      maximum age of last-known-good data that may still be served
 * @param minSuccessRate fan-outs below this fraction of successful sources log a warning
 */
public record DegradationSettings(Duration sourceTimeout, Duration freshness, double minSuccessRate) {

    public static final DegradationSettings DEFAULTS =
        new DegradationSettings(Duration.ofSeconds(15), Duration.ofHours(1), 0.3);

    public DegradationSettings {
        if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
            throw new IllegalArgumentException("minSuccessRate must be within [0, 1], got " + minSuccessRate);
        }
    }
}
