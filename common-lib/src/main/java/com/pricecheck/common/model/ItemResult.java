package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of checking one input term against one source. A {@code null} {@code bestMatch}
 * means no candidate cleared the matcher's minimum similarity, which is a normal result.
 */
public record ItemResult(
    @JsonProperty("input") String input,
    @JsonProperty("retailer") String source,
    @JsonProperty("bestMatch") String bestMatch,
    @JsonProperty("matchScore") Double matchScore,
    @JsonProperty("confidence") MatchConfidence confidence,
    @JsonProperty("alternatives") List<AlternativeProduct> alternatives,
    @JsonProperty("onSale") boolean onSale,
    @JsonProperty("price") Double price,
    @JsonProperty("was") Double was,
    @JsonProperty("promoText") String promoText,
    @JsonProperty("url") String url,
    @JsonProperty("inStock") Boolean inStock,
    @JsonProperty("potentialSavings") List<PotentialSaving> potentialSavings
) {

    public static ItemResult noMatch(String input, String source) {
        return new ItemResult(input, source, null, null, null, List.of(), false,
            null, null, null, null, null, List.of());
    }

    public boolean hasMatch() {
        return bestMatch != null;
    }
}
