package com.pricecheck.checker.client;

import java.time.Duration;

/**
 * Observability record for a single attempt; {@code retryDelay} is {@link Duration#ZERO}
 * when no retry follows. Created per attempt, logged, handed to listeners, discarded.
 */
public record RetryAttempt(
    String source,
    int attempt,
    Duration latency,
    AttemptStatus status,
    Integer httpStatus,
    Duration retryDelay
) {}
