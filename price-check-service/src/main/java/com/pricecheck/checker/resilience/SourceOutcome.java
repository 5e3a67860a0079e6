package com.pricecheck.checker.resilience;

public record SourceOutcome<T>(String sourceName, ServiceResult<T> result) {}
