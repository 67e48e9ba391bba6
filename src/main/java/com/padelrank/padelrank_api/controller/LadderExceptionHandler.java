package com.padelrank.padelrank_api.controller;

import com.padelrank.padelrank_api.service.LadderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LadderExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(LadderExceptionHandler.class);

    @ExceptionHandler(LadderException.class)
    public ResponseEntity<ErrorResponse> handle(LadderException ex) {
        HttpStatus status = statusFor(ex.getKind());
        log.debug("Request refused ({}): {}", ex.getReason().code(), ex.getMessage());
        return ResponseEntity
                .status(status)
                .body(new ErrorResponse(ex.getReason().code(), ex.getMessage()));
    }

    static HttpStatus statusFor(LadderException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case RULE_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
        };
    }

    public record ErrorResponse(String code, String message) {}
}
