package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedCandidate(
    @JsonProperty("candidate") ProductCandidate candidate,
    @JsonProperty("score") MatchScore score
) {}
