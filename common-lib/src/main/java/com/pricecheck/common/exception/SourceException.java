package com.pricecheck.common.exception;

/**
 * Signals that a retailer source could not produce a result. Raised inside an orchestrated
 * primary call so the circuit breaker counts it; it never reaches API callers.
 */
public class SourceException extends PriceCheckException {

    private final String sourceName;

    public SourceException(String sourceName, String message) {
        super("[" + sourceName + "] " + message);
        this.sourceName = sourceName;
    }

    public SourceException(String sourceName, String message, Throwable cause) {
        super("[" + sourceName + "] " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
