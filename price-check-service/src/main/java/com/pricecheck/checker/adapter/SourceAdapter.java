package com.pricecheck.checker.adapter;

import reactor.core.publisher.Mono;

/**
 * A retailer search endpoint.
 *
 * <p>{@link #search} never signals an error; transport and parse problems come back as
 * {@link SourceResponse#failure}.
 */
public interface SourceAdapter {

    String sourceName();

    Mono<SourceResponse> search(String query, String location);
}
