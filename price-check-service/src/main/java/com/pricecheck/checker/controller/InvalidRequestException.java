package com.pricecheck.checker.controller;

import com.pricecheck.common.exception.PriceCheckException;

import java.util.List;

/** Request failed validation; answered with 400 and every violation found. */
public class InvalidRequestException extends PriceCheckException {

    private final List<String> violations;

    public InvalidRequestException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidRequestException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
