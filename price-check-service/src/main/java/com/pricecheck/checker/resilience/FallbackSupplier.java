package com.pricecheck.checker.resilience;

import reactor.core.publisher.Mono;

/**
 * Alternative way of producing a value once the primary call has failed or its circuit is
 * open. An error or empty signal from {@link #invoke()} moves on to last-known-good data.
 */
@FunctionalInterface
public interface FallbackSupplier<T> {

    Mono<T> invoke();
}
