package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Score of one (query, candidate name) pair with its component breakdown.
 * {@code totalScore} is capped at 1.0.
 */
public record MatchScore(
    @JsonProperty("totalScore") double totalScore,
    @JsonProperty("baseSimilarity") double baseSimilarity,
    @JsonProperty("exactMatchBonus") double exactMatchBonus,
    @JsonProperty("brandMatchBonus") double brandMatchBonus,
    @JsonProperty("sizeMatchBonus") double sizeMatchBonus,
    @JsonProperty("keywordMatchBonus") double keywordMatchBonus,
    @JsonProperty("confidence") MatchConfidence confidence
) {

    public static final MatchScore NONE = new MatchScore(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, MatchConfidence.LOW);

    public double totalBonus() {
        return exactMatchBonus + brandMatchBonus + sizeMatchBonus + keywordMatchBonus;
    }
}
