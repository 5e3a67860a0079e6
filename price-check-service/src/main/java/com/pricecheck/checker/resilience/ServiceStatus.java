package com.pricecheck.checker.resilience;

/** Last observed health of a source, as reported by the status endpoint. */
public enum ServiceStatus {
    AVAILABLE,
    DEGRADED,
    UNAVAILABLE
}
