package com.pricecheck.checker.adapter;

import com.pricecheck.common.model.ProductCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Secondary way of searching a retailer, e.g. by driving a headless browser against its
 * web UI. Consulted by an adapter only after its HTTP path has failed. No implementation
 * ships with the service; registering a bean of this type enables it.
 */
public interface BrowserSearchFallback {

    /** Retailer this fallback can search, matching {@link SourceAdapter#sourceName()}. */
    String sourceName();

    Mono<List<ProductCandidate>> search(String query, String location);
}
