package com.pricecheck.checker.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record PricePoint(
    @JsonProperty("productKey") String productKey,
    @JsonProperty("name") String name,
    @JsonProperty("retailer") String source,
    @JsonProperty("price") Double price,
    @JsonProperty("was") Double was,
    @JsonProperty("onSale") boolean onSale,
    @JsonProperty("promoText") String promoText,
    @JsonProperty("recordedAt") LocalDateTime recordedAt
) {

    static PricePoint from(PriceHistoryRecord entity) {
        return new PricePoint(entity.getProductKey(), entity.getProductName(), entity.getSource(),
            entity.getPrice(), entity.getWasPrice(), entity.isOnSale(), entity.getPromoText(),
            entity.getRecordedAt());
    }
}
