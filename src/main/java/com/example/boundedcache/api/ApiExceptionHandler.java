package com.example.boundedcache.api;

import com.example.boundedcache.refresh.CacheLoadException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(CacheLoadException.class)
    public ResponseEntity<Map<String, String>> handleLoadFailure(CacheLoadException e) {
        log.warn("Read-through load failed for key={}", e.getKey(), e);
        return error(HttpStatus.BAD_GATEWAY, "load_failed", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
            .body(Map.of("error", error, "message", message == null ? "" : message));
    }
}
