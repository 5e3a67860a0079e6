package com.pricecheck.common.matching;

/**
 * Tunable thresholds and bonus weights for {@link ProductMatcher}.
 *
 * @param minSimilarity        candidates scoring below this are never ranked
 * @param highConfidence       score at or above which confidence is HIGH
 * @param mediumConfidence     score at or above which confidence is MEDIUM
 * @param exactMatchBonus      scaled by the fraction of query keywords found in the candidate
 * @param brandMatchBonus      flat bonus when a known brand appears in both strings
 * @param sizeMatchBonus       cap of the size/unit bonus
 * @param keywordMatchBonus    per overlapping keyword, counted for at most three keywords
 */
public record MatchingThresholds(
    double minSimilarity,
    double highConfidence,
    double mediumConfidence,
    double exactMatchBonus,
    double brandMatchBonus,
    double sizeMatchBonus,
    double keywordMatchBonus
) {

    public static final MatchingThresholds DEFAULTS =
        new MatchingThresholds(0.3, 0.8, 0.6, 0.2, 0.15, 0.1, 0.05);

    public MatchingThresholds {
        if (mediumConfidence > highConfidence) {
            throw new IllegalArgumentException(
                "mediumConfidence (" + mediumConfidence + ") must not exceed highConfidence (" + highConfidence + ")");
        }
    }
}
