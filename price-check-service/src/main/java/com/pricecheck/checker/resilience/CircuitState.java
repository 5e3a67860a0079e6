package com.pricecheck.checker.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
