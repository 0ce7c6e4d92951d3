package com.ops.alertdecision.controller;

import com.ops.alertdecision.exception.AlertDecisionException;
import com.ops.alertdecision.exception.InvalidAlertException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps engine failures that escape a controller onto JSON error bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidAlertException.class)
    public ResponseEntity<Map<String, String>> handleInvalidAlert(InvalidAlertException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", ex.getMessage(),
                "field", ex.getField()));
    }

    @ExceptionHandler(AlertDecisionException.class)
    public ResponseEntity<Map<String, String>> handleEngineError(AlertDecisionException ex) {
        log.warn("Request failed with {}: {}", ex.getErrorCode().getCode(), ex.getMessage());
        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(Map.of(
                "error", ex.getErrorCode().getCode(),
                "message", ex.getMessage()));
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, String>> handleRejected(RejectedExecutionException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "error", "WORKERS_BUSY",
                "message", "Alert queue is full or shutting down, retry later"));
    }

    /**
     * Failures of a pipeline run on the worker pool arrive wrapped by {@code join()}.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, String>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof InvalidAlertException invalid) {
            return handleInvalidAlert(invalid);
        }
        if (cause instanceof AlertDecisionException engineError) {
            return handleEngineError(engineError);
        }
        if (cause instanceof RejectedExecutionException rejected) {
            return handleRejected(rejected);
        }
        log.error("Alert pipeline failed unexpectedly", cause != null ? cause : ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "INTERNAL_ERROR",
                "message", "Alert processing failed"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Malformed request body",
                "field", "body"));
    }
}
