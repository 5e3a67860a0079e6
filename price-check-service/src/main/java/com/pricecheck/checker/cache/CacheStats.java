package com.pricecheck.checker.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
    @JsonProperty("size") int size,
    @JsonProperty("maxSize") int maxSize,
    @JsonProperty("expiredItems") int expiredItems,
    @JsonProperty("defaultTtlSeconds") long defaultTtlSeconds,
    @JsonProperty("hits") long hits,
    @JsonProperty("misses") long misses,
    @JsonProperty("evictions") long evictions
) {}
