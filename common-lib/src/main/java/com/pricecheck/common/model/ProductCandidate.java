package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One product returned by a retailer source for a search query.
 *
 * <p>{@code name} is the display name (pack size appended when the retailer keeps it in a
 * separate field). {@code disambiguator} is an opaque, source-specific token that is unique
 * per physical SKU (e.g. {@code "WOW:123456"}); it is never shown to users and only takes
 * part in {@link #productKey()}.
 */
public record ProductCandidate(
    @JsonProperty("name") String name,
    @JsonProperty("price") Double price,
    @JsonProperty("was") Double wasPrice,
    @JsonProperty("promoFlag") boolean promoFlag,
    @JsonProperty("promoText") String promoText,
    @JsonProperty("url") String url,
    @JsonProperty("inStock") Boolean inStock,
    @JsonProperty("source") String source,
    @JsonProperty("disambiguator") String disambiguator
) {

    public static ProductCandidate of(String name, Double price, String source) {
        return new ProductCandidate(name, price, null, false, null, null, null, source, null);
    }

    /**
     * On sale when flagged as a promotion, when the current price is below the previous
     * price, or when the retailer attached promotional text.
     */
    @JsonIgnore
    public boolean onSale() {
        if (promoFlag) {
            return true;
        }
        if (price != null && wasPrice != null && price < wasPrice) {
            return true;
        }
        return promoText != null && !promoText.isBlank();
    }

    /** Persistence key: display name plus the opaque disambiguator when present. */
    @JsonIgnore
    public String productKey() {
        if (disambiguator == null || disambiguator.isBlank()) {
            return name;
        }
        return name + " [" + disambiguator + "]";
    }
}
