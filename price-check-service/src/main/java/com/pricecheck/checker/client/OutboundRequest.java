package com.pricecheck.checker.client;

import java.util.Map;

/**
 * One logical GET against a retailer endpoint. {@code query} and {@code location} are only
 * used to enrich log lines.
 */
public record OutboundRequest(
    String source,
    String url,
    Map<String, ?> queryParams,
    Map<String, String> headers,
    String query,
    String location
) {}
