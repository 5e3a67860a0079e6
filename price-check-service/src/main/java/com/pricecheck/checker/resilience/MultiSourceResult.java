package com.pricecheck.checker.resilience;

import java.util.List;

/**
 * Results of a fan-out, one per source in the order the sources were given.
 */
public record MultiSourceResult<T>(List<SourceOutcome<T>> outcomes, double successRate) {

    public List<SourceOutcome<T>> successful() {
        return outcomes.stream().filter(o -> o.result().success()).toList();
    }

    public int total() {
        return outcomes.size();
    }
}
