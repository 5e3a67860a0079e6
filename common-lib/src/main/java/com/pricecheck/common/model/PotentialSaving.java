package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PotentialSaving(
    @JsonProperty("alternative") String alternative,
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("alternativePrice") double alternativePrice,
    @JsonProperty("savings") double savings,
    @JsonProperty("percentage") double percentage
) {}
