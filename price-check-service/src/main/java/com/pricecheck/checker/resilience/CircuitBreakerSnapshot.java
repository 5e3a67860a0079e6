package com.pricecheck.checker.resilience;

import java.time.Instant;

public record CircuitBreakerSnapshot(
    String serviceName,
    CircuitState state,
    int failureCount,
    Instant lastFailureTime,
    int failureThreshold,
    long timeoutSeconds
) {}
