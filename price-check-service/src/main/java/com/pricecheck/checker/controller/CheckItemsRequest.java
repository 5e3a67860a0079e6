package com.pricecheck.checker.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/check}. {@code items} is a comma-separated list such as
 * {@code "milk 2L, bread"}.
 */
public record CheckItemsRequest(
    @JsonProperty("items") String items,
    @JsonProperty("postcode") String postcode
) {}
