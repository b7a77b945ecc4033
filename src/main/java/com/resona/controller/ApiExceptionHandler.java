package com.resona.controller;

import com.resona.exception.AudioGenerationException;
import com.resona.exception.FatalSynthesisException;
import com.resona.exception.GenerationTimeoutException;
import com.resona.exception.GenerationUnavailableException;
import com.resona.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Maps synthesis failures to HTTP status codes.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({GenerationUnavailableException.class, TransientDependencyException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException e) {
        log.warn("Synthesis unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(GenerationTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(GenerationTimeoutException e) {
        log.warn(e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(CancellationException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(AudioGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleGenerationFailure(AudioGenerationException e) {
        Throwable cause = e.getCause();
        if (cause instanceof TransientDependencyException) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
        if (cause instanceof FatalSynthesisException) {
            return error(HttpStatus.BAD_REQUEST, cause.getMessage());
        }
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
