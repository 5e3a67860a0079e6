package com.pricecheck.checker.ratelimit;

import java.time.Instant;
import java.util.Map;

public record ClientStats(
    String clientId,
    boolean blocked,
    Instant blockedUntil,
    Instant lastSeen,
    Map<RateLimitClass, ClassUsage> usage
) {

    public record ClassUsage(int requestsInWindow, int limit, double tokens, int burst) {}
}
