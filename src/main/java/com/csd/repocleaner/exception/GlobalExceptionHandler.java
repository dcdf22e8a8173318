package com.csd.repocleaner.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRuleException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRule(InvalidRuleException ex) {
        log.warn("Invalid rule: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_RULE", ex.getPattern());
    }

    @ExceptionHandler(NexusApiException.class)
    public ResponseEntity<Map<String, String>> handleNexus(NexusApiException ex) {
        log.error("Nexus error: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage(), "NEXUS_ERROR", null);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request", "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_ERROR", ex.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String code, String details) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        if (details != null) body.put("details", details);
        return ResponseEntity.status(status).body(body);
    }
}
