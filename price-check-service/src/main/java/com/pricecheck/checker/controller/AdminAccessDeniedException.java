package com.pricecheck.checker.controller;

import com.pricecheck.common.exception.PriceCheckException;

public class AdminAccessDeniedException extends PriceCheckException {

    public AdminAccessDeniedException(String message) {
        super(message);
    }
}
