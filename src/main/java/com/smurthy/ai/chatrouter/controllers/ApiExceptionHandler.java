package com.smurthy.ai.chatrouter.controllers;

import com.smurthy.ai.chatrouter.service.CycleCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps caller errors and cancelled cycles to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorReply> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorReply(e.getMessage()));
    }

    @ExceptionHandler(CycleCancelledException.class)
    public ResponseEntity<ErrorReply> cancelled(CycleCancelledException e) {
        log.warn("Request cancelled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorReply("Request was cancelled"));
    }

    public record ErrorReply(String error) {}
}
