package com.pricecheck.checker.resilience;

/**
 * Outcome of one orchestrated call. {@code fallbackUsed} is set whenever {@code data} did
 * not come from the primary call, and {@code degradationReason} says why.
 */
public record ServiceResult<T>(
    boolean success,
    T data,
    String error,
    long responseTimeMs,
    boolean fallbackUsed,
    String degradationReason
) {

    public static <T> ServiceResult<T> success(T data, long responseTimeMs) {
        return new ServiceResult<>(true, data, null, responseTimeMs, false, null);
    }

    public static <T> ServiceResult<T> fallback(T data, long responseTimeMs, String reason) {
        return new ServiceResult<>(true, data, null, responseTimeMs, true, reason);
    }

    public static <T> ServiceResult<T> failure(String error, long responseTimeMs, String reason) {
        return new ServiceResult<>(false, null, error, responseTimeMs, false, reason);
    }
}
