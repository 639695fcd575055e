package com.incoresoft.blePresence.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.incoresoft.blePresence.domain.query.BeaconNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BeaconNotFoundException.class)
    public ResponseEntity<?> handleNotFound(BeaconNotFoundException ex) {
        log.info("Lookup miss: {}", ex.getIdentity());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody("not_found", ex.getMessage()));
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<?> handleUnreadableJson(JsonProcessingException ex) {
        log.warn("[INGEST] Unreadable report: {}", ex.getOriginalMessage());
        return ResponseEntity.badRequest().body(errorBody("bad_request", ex.getOriginalMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage(), ex);
        return ResponseEntity.badRequest().body(errorBody("validation_error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage(), ex);
        return ResponseEntity.badRequest().body(errorBody("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleAny(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("internal_error", "Unexpected error"));
    }

    private Map<String, Object> errorBody(String code, String message) {
        return Map.of(
                "success", false,
                "timestamp", Instant.now().toString(),
                "code", code,
                "message", Objects.toString(message, code)
        );
    }
}
