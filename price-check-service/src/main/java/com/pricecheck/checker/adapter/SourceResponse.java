package com.pricecheck.checker.adapter;

import com.pricecheck.common.model.ProductCandidate;

import java.util.List;

/**
 * Tagged result of one source search. An empty {@code candidates} list on success is a
 * legitimate "nothing found".
 */
public record SourceResponse(
    String source,
    boolean success,
    List<ProductCandidate> candidates,
    String error,
    boolean fromFallback
) {

    public static SourceResponse success(String source, List<ProductCandidate> candidates) {
        return new SourceResponse(source, true, List.copyOf(candidates), null, false);
    }

    public static SourceResponse fromFallback(String source, List<ProductCandidate> candidates) {
        return new SourceResponse(source, true, List.copyOf(candidates), null, true);
    }

    public static SourceResponse failure(String source, String error) {
        return new SourceResponse(source, false, List.of(), error, false);
    }
}
