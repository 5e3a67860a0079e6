package com.pricecheck.common.exception;

/**
 * Root of the price checker's unchecked exceptions.
 */
public class PriceCheckException extends RuntimeException {

    public PriceCheckException(String message) {
        super(message);
    }

    public PriceCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
