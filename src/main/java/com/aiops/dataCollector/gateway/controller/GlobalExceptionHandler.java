package com.aiops.dataCollector.gateway.controller;

import com.aiops.dataCollector.cache.exception.CacheUnavailableException;
import com.aiops.dataCollector.gateway.dto.StatusResponse;
import com.aiops.dataCollector.gateway.exception.MissingIdentityException;
import com.aiops.dataCollector.identity.InvalidIdentityException;
import com.aiops.dataCollector.worker.exception.JobRejectedException;
import com.aiops.dataCollector.worker.exception.NoWorkerConfiguredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the collector endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingIdentityException.class)
    public ResponseEntity<StatusResponse> handleMissingIdentity(MissingIdentityException ex) {
        log.warn("Request denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(StatusResponse.error("Unauthorized", ex.getMessage()));
    }

    @ExceptionHandler(InvalidIdentityException.class)
    public ResponseEntity<StatusResponse> handleInvalidIdentity(InvalidIdentityException ex) {
        log.warn("Invalid identity: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(StatusResponse.error("Bad Request", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StatusResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(StatusResponse.error("Bad Request", "Request body is not valid JSON"));
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public ResponseEntity<StatusResponse> handleCacheUnavailable(CacheUnavailableException ex) {
        log.error("Processed cache unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(StatusResponse.error("Error", "Required service not operational"));
    }

    @ExceptionHandler({JobRejectedException.class, NoWorkerConfiguredException.class})
    public ResponseEntity<StatusResponse> handleNotAccepted(RuntimeException ex) {
        log.warn("Job not accepted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(StatusResponse.error("Error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StatusResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(StatusResponse.error("Error", "An unexpected error occurred"));
    }
}
