package com.pricecheck.checker.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps exceptions escaping controllers to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(InvalidRequestException e) {
        log.info("Invalid request rejected. violations={}", e.getViolations());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("Invalid request", e.getMessage(), e.getViolations()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableInput(ServerWebInputException e) {
        log.info("Unreadable request rejected. reason={}", e.getReason());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of("Invalid request", e.getReason() == null ? "Malformed request" : e.getReason()));
    }

    @ExceptionHandler(AdminAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> adminDenied(AdminAccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(ErrorResponse.of("Forbidden", e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> statusException(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String error = status == null ? "Error" : status.getReasonPhrase();
        return ResponseEntity.status(e.getStatusCode())
            .body(ErrorResponse.of(error, e.getReason() == null ? error : e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled request error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("Internal server error", "An unexpected error occurred"));
    }
}
