package com.pricecheck.checker.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Terminal result of {@link RetryingRequestExecutor#execute}. Transport problems are carried
 * here as values; the executor never signals an error.
 */
public record RequestOutcome(
    AttemptStatus status,
    JsonNode payload,
    Integer httpStatus,
    int attempts,
    String error
) {
    public static RequestOutcome success(JsonNode payload, int httpStatus, int attempts) {
        return new RequestOutcome(AttemptStatus.SUCCESS, payload, httpStatus, attempts, null);
    }

    public static RequestOutcome failure(AttemptStatus status, Integer httpStatus, int attempts, String error) {
        return new RequestOutcome(status, null, httpStatus, attempts, error);
    }

    public boolean succeeded() {
        return status == AttemptStatus.SUCCESS;
    }
}
