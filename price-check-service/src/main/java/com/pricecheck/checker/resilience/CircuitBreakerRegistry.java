package com.pricecheck.checker.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Lazily creates one {@link CircuitBreaker} per service name and keeps it for the process lifetime. */
public class CircuitBreakerRegistry {

    private final int failureThreshold;
    private final Duration timeout;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int failureThreshold, Duration timeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.timeout          = timeout;
        this.clock            = clock;
    }

    public CircuitBreaker get(String serviceName) {
        return breakers.computeIfAbsent(serviceName,
            name -> new CircuitBreaker(name, failureThreshold, timeout, clock));
    }

    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> snapshots = new TreeMap<>();
        breakers.forEach((name, breaker) -> snapshots.put(name, breaker.snapshot()));
        return snapshots;
    }
}
