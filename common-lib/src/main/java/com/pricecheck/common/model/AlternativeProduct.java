package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A ranked runner-up for an item, as returned to clients.
 */
public record AlternativeProduct(
    @JsonProperty("name") String name,
    @JsonProperty("price") Double price,
    @JsonProperty("was") Double was,
    @JsonProperty("onSale") boolean onSale,
    @JsonProperty("promoText") String promoText,
    @JsonProperty("url") String url,
    @JsonProperty("matchScore") double matchScore
) {
    public static AlternativeProduct from(RankedCandidate ranked) {
        ProductCandidate c = ranked.candidate();
        return new AlternativeProduct(c.name(), c.price(), c.wasPrice(), c.onSale(),
            c.promoText(), c.url(), Math.round(ranked.score().totalScore() * 100.0) / 100.0);
    }
}
