package com.pricecheck.common.model;

/**
 * Coarse confidence label attached to a {@link MatchScore}, derived from the matcher's
 * high/medium thresholds.
 */
public enum MatchConfidence {
    LOW,
    MEDIUM,
    HIGH
}
