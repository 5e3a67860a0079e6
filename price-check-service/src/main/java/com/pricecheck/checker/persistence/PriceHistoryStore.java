package com.pricecheck.checker.persistence;

import com.pricecheck.common.model.AlternativeProduct;
import com.pricecheck.common.model.ProductCandidate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of observed prices and alternatives. Writers are fire-and-forget from the
 * caller's point of view; a failed write must never fail a price check.
 */
public interface PriceHistoryStore {

    Mono<Void> recordPrice(ProductCandidate candidate, Instant timestamp);

    Mono<Void> recordAlternatives(String query, String source, List<AlternativeProduct> alternatives, Instant timestamp);

    /** Oldest first, limited to the last {@code windowDays} days. */
    Flux<PricePoint> readPriceHistory(String productKey, int windowDays);

    /** Most recent first. Queries are matched case-insensitively. */
    Flux<StoredAlternative> readAlternatives(String query, int limit);
}
