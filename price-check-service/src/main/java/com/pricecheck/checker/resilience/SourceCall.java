package com.pricecheck.checker.resilience;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * One source taking part in a multi-source search.
 *
 * @param fallbackKey identifies the request inside the source, so last-known-good data is
 *                    only ever served for the same request
 * @param fallback    optional, may be {@code null}
 * @param timeout     optional, {@code null} uses the orchestrator's default source timeout
 */
public record SourceCall<T>(
    String sourceName,
    String fallbackKey,
    Supplier<Mono<T>> primary,
    FallbackSupplier<T> fallback,
    Duration timeout
) {

    public static <T> SourceCall<T> of(String sourceName, String fallbackKey, Supplier<Mono<T>> primary) {
        return new SourceCall<>(sourceName, fallbackKey, primary, null, null);
    }
}
