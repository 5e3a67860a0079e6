package com.pricecheck.checker.resilience;

import com.pricecheck.checker.cache.CacheLookup;
import com.pricecheck.checker.cache.TtlLruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs source calls behind per-source circuit breakers and degrades gracefully.
 *
 * <p><strong>Degradation chain</strong> for {@link #executeWithDegradation}:
 * <ol>
 *   <li>primary, under the call's timeout, unless the breaker refuses it;</li>
 *   <li>the caller-supplied {@link FallbackSupplier}, when given;</li>
 *   <li>last-known-good data for the same (service, fallbackKey), when younger than the
 *       configured freshness bound;</li>
 *   <li>a failed {@link ServiceResult} carrying the original error.</li>
 * </ol>
 * The returned {@code Mono} never errors. Only a primary success refreshes last-known-good data.
 *
 * <p>{@link #executeMultiSourceSearch} subscribes to every source at once and reports results
 * in input order regardless of completion order. A success rate under
 * {@link DegradationSettings#minSuccessRate()} is logged but does not fail the search.
 */
public class DegradationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DegradationOrchestrator.class);

    private final CircuitBreakerRegistry breakers;
    private final TtlLruCache<Object> lastKnownGood;
    private final DegradationSettings settings;
    private final Clock clock;
    private final Map<String, ServiceStatus> serviceStatus = new ConcurrentHashMap<>();

    /**
     * @param lastKnownGood store for primary successes; its default TTL should equal
     *                      {@code settings.freshness()}
     */
    public DegradationOrchestrator(CircuitBreakerRegistry breakers, TtlLruCache<Object> lastKnownGood,
                                   DegradationSettings settings, Clock clock) {
        this.breakers      = breakers;
        this.lastKnownGood = lastKnownGood;
        this.settings      = settings;
        this.clock         = clock;
    }

    public DegradationSettings settings() {
        return settings;
    }

    public <T> Mono<ServiceResult<T>> executeWithDegradation(String serviceName, String fallbackKey,
                                                            Supplier<Mono<T>> primary,
                                                            FallbackSupplier<T> fallback,
                                                            Duration timeout) {
        Duration bound = timeout != null ? timeout : settings.sourceTimeout();
        return Mono.defer(() -> {
            long startedMs = clock.millis();
            CircuitBreaker breaker = breakers.get(serviceName);

            if (!breaker.allowRequest()) {
                log.warn("CIRCUIT_OPEN_SKIP service={} key={}", serviceName, fallbackKey);
                return degrade(serviceName, fallbackKey, fallback, startedMs,
                    "circuit breaker open", "circuit breaker open for " + serviceName);
            }

            return Mono.defer(primary)
                .timeout(bound)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("primary completed without a value")))
                .map(data -> {
                    breaker.recordSuccess();
                    lastKnownGood.put(serviceName, fallbackKey, "", data);
                    serviceStatus.put(serviceName, ServiceStatus.AVAILABLE);
                    long elapsed = clock.millis() - startedMs;
                    log.debug("PRIMARY_SUCCESS service={} key={} responseTimeMs={}", serviceName, fallbackKey, elapsed);
                    return ServiceResult.success(data, elapsed);
                })
                .onErrorResume(e -> {
                    breaker.recordFailure();
                    boolean timedOut = e instanceof TimeoutException;
                    String reason = timedOut ? "timeout after " + bound.toMillis() + "ms" : "primary failed";
                    String error  = timedOut ? reason : String.valueOf(e.getMessage());
                    log.warn("PRIMARY_FAILED service={} key={} reason={} error={}",
                        serviceName, fallbackKey, reason, error);
                    return degrade(serviceName, fallbackKey, fallback, startedMs, reason, error);
                })
                .doOnCancel(() -> {
                    log.debug("PRIMARY_CANCELLED service={} key={}", serviceName, fallbackKey);
                    breaker.releaseTrial();
                });
        }).onErrorResume(e -> {
            log.error("DEGRADATION_UNEXPECTED service={} key={}", serviceName, fallbackKey, e);
            serviceStatus.put(serviceName, ServiceStatus.UNAVAILABLE);
            return Mono.just(ServiceResult.failure(String.valueOf(e.getMessage()), 0, "unexpected error"));
        });
    }

    public <T> Mono<MultiSourceResult<T>> executeMultiSourceSearch(List<SourceCall<T>> calls) {
        if (calls == null || calls.isEmpty()) {
            return Mono.just(new MultiSourceResult<>(List.of(), 0.0));
        }
        return Flux.fromIterable(calls)
            .flatMapSequential(call -> this.<T>executeWithDegradation(call.sourceName(), call.fallbackKey(),
                    call.primary(), call.fallback(), call.timeout())
                .map(result -> new SourceOutcome<>(call.sourceName(), result)))
            .collectList()
            .map(outcomes -> {
                long succeeded = outcomes.stream().filter(o -> o.result().success()).count();
                double successRate = (double) succeeded / outcomes.size();
                if (successRate < settings.minSuccessRate()) {
                    log.warn("LOW_SUCCESS_RATE sources={} succeeded={} successRate={} minSuccessRate={}",
                        outcomes.size(), succeeded, successRate, settings.minSuccessRate());
                } else {
                    log.info("MULTI_SOURCE_COMPLETE sources={} succeeded={} successRate={}",
                        outcomes.size(), succeeded, successRate);
                }
                return new MultiSourceResult<>(outcomes, successRate);
            });
    }

    /** Fan-out over named primaries without fallbacks; iteration order of the map is kept. */
    public <T> Mono<MultiSourceResult<T>> executeMultiSourceSearch(Map<String, Supplier<Mono<T>>> primaries,
                                                                 String fallbackKey) {
        List<SourceCall<T>> calls = primaries.entrySet().stream()
            .map(e -> SourceCall.of(e.getKey(), fallbackKey, e.getValue()))
            .toList();
        return executeMultiSourceSearch(calls);
    }

    public DegradationStatus statusSummary() {
        Map<String, ServiceStatus> services = new TreeMap<>(serviceStatus);
        Map<ServiceStatus, Long> counts = new EnumMap<>(ServiceStatus.class);
        for (ServiceStatus status : ServiceStatus.values()) {
            counts.put(status, 0L);
        }
        services.values().forEach(s -> counts.merge(s, 1L, Long::sum));
        return new DegradationStatus(services.size(), counts, services,
            new LinkedHashMap<>(breakers.snapshots()), lastKnownGood.size());
    }

    public ServiceStatus status(String serviceName) {
        return serviceStatus.get(serviceName);
    }

    // ── degradation chain ────────────────────────────────────────────────────

    private <T> Mono<ServiceResult<T>> degrade(String serviceName, String fallbackKey, FallbackSupplier<T> fallback,
                                              long startedMs, String reason, String error) {
        if (fallback == null) {
            return Mono.fromSupplier(() -> fromLastKnownGood(serviceName, fallbackKey, startedMs, reason, error));
        }
        return Mono.defer(fallback::invoke)
            .map(data -> {
                serviceStatus.put(serviceName, ServiceStatus.DEGRADED);
                log.info("FALLBACK_USED service={} key={} reason={}", serviceName, fallbackKey, reason);
                return ServiceResult.fallback(data, clock.millis() - startedMs, reason + "; fallback function used");
            })
            .onErrorResume(e -> {
                log.warn("FALLBACK_FAILED service={} key={} error={}", serviceName, fallbackKey, e.getMessage());
                return Mono.fromSupplier(() -> fromLastKnownGood(serviceName, fallbackKey, startedMs, reason, error));
            })
            .switchIfEmpty(Mono.fromSupplier(() -> fromLastKnownGood(serviceName, fallbackKey, startedMs, reason, error)));
    }

    @SuppressWarnings("unchecked")
    private <T> ServiceResult<T> fromLastKnownGood(String serviceName, String fallbackKey, long startedMs,
                                                  String reason, String error) {
        long elapsed = clock.millis() - startedMs;
        CacheLookup<Object> cached = lastKnownGood.lookup(serviceName, fallbackKey, "");
        if (cached.hit()) {
            serviceStatus.put(serviceName, ServiceStatus.DEGRADED);
            log.info("LAST_KNOWN_GOOD_USED service={} key={} storedAt={} reason={}",
                serviceName, fallbackKey, cached.storedAt(), reason);
            return ServiceResult.fallback((T) cached.value(), elapsed,
                reason + "; served last-known-good data from " + cached.storedAt());
        }
        serviceStatus.put(serviceName, ServiceStatus.UNAVAILABLE);
        log.error("SERVICE_UNAVAILABLE service={} key={} reason={} error={}", serviceName, fallbackKey, reason, error);
        return ServiceResult.failure(error, elapsed, reason + "; no fallback available");
    }
}
