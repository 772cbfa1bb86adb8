package com.autonomous.analysis.controller;

import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.exception.RunNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> configuration(ConfigurationException ex) {
        return ResponseEntity.badRequest().body(body("configuration_error", ex.getMessage()));
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(RunNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("not_found", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(err -> err.getField() + " " + err.getDefaultMessage())
            .orElse("validation failed");
        return ResponseEntity.badRequest().body(body("validation_error", msg));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(body("bad_request", "malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> internal(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("internal_error", ex.getMessage() == null ? "unexpected error" : ex.getMessage()));
    }

    private Map<String, Object> body(String error, String message) {
        return Map.of(
            "timestamp", Instant.now().toString(),
            "error", error,
            "message", message
        );
    }
}
