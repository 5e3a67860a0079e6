package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CheckItemsResponse(
    @JsonProperty("results") List<ItemResult> results,
    @JsonProperty("postcode") String location,
    @JsonProperty("itemsChecked") int itemsChecked
) {}
