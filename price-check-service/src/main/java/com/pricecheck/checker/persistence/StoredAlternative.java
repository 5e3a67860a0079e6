package com.pricecheck.checker.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record StoredAlternative(
    @JsonProperty("name") String name,
    @JsonProperty("retailer") String source,
    @JsonProperty("price") Double price,
    @JsonProperty("was") Double was,
    @JsonProperty("onSale") boolean onSale,
    @JsonProperty("promoText") String promoText,
    @JsonProperty("url") String url,
    @JsonProperty("matchScore") Double matchScore,
    @JsonProperty("recordedAt") LocalDateTime recordedAt
) {

    static StoredAlternative from(AlternativeProductRecord entity) {
        return new StoredAlternative(entity.getProductName(), entity.getSource(), entity.getPrice(),
            entity.getWasPrice(), entity.isOnSale(), entity.getPromoText(), entity.getUrl(),
            entity.getMatchScore(), entity.getRecordedAt());
    }
}
