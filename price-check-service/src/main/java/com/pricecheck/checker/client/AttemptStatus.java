package com.pricecheck.checker.client;

/**
 * Classification of one outbound attempt.
 */
public enum AttemptStatus {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE,
    TIMEOUT,
    NETWORK_ERROR;

    public boolean retryable() {
        return this == RETRYABLE_FAILURE || this == TIMEOUT || this == NETWORK_ERROR;
    }
}
