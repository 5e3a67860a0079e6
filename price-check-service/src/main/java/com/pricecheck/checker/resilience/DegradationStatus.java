package com.pricecheck.checker.resilience;

import java.util.Map;

public record DegradationStatus(
    int totalServices,
    Map<ServiceStatus, Long> statusCounts,
    Map<String, ServiceStatus> services,
    Map<String, CircuitBreakerSnapshot> circuitBreakers,
    int lastKnownGoodEntries
) {}
