package com.pricecheck.checker.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-source circuit breaker.
 *
 * <pre>
 *   CLOSED    --failureCount reaches threshold-->        OPEN
 *   OPEN      --more than timeout since last failure-->  HALF_OPEN (one trial admitted)
 *   HALF_OPEN --trial succeeds-->                        CLOSED, failureCount = 0
 *   HALF_OPEN --trial fails-->                           OPEN, timeout restarts
 * </pre>
 *
 * While half-open only one trial call is outstanding; further requests are refused until
 * the trial reports back or is released. All transitions are serialized on the instance monitor.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceName;
    private final int failureThreshold;
    private final Duration timeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String serviceName, int failureThreshold, Duration timeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive, got " + failureThreshold);
        }
        this.serviceName      = serviceName;
        this.failureThreshold = failureThreshold;
        this.timeout          = timeout;
        this.clock            = clock;
    }

    /**
     * Whether the primary call may be attempted now. Moves OPEN to HALF_OPEN once the timeout
     * has elapsed and hands out the single half-open trial.
     */
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (lastFailureTime != null
                        && Duration.between(lastFailureTime, clock.instant()).compareTo(timeout) > 0) {
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                    log.info("CIRCUIT_HALF_OPEN service={} failureCount={}", serviceName, failureCount);
                    return true;
                }
                return false;
            case HALF_OPEN:
                if (!trialInFlight) {
                    trialInFlight = true;
                    return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unknown circuit state " + state);
        }
    }

    public synchronized void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("CIRCUIT_CLOSED service={} previousState={}", serviceName, state);
        }
        state = CircuitState.CLOSED;
        failureCount = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.OPEN;
            trialInFlight = false;
            log.warn("CIRCUIT_REOPENED service={} failureCount={}", serviceName, failureCount);
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            state = CircuitState.OPEN;
            log.warn("CIRCUIT_OPENED service={} failureCount={} threshold={} timeoutSeconds={}",
                serviceName, failureCount, failureThreshold, timeout.toSeconds());
        }
    }

    /**
     * Gives back a half-open trial that ended without an outcome, e.g. a cancelled call.
     * The breaker stays half-open and the next caller takes the trial.
     */
    public synchronized void releaseTrial() {
        if (state == CircuitState.HALF_OPEN && trialInFlight) {
            trialInFlight = false;
            log.info("CIRCUIT_TRIAL_RELEASED service={}", serviceName);
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(serviceName, state, failureCount, lastFailureTime,
            failureThreshold, timeout.toSeconds());
    }

    public String serviceName() {
        return serviceName;
    }
}
