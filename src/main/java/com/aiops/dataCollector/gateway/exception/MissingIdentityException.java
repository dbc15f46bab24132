package com.aiops.dataCollector.gateway.exception;

/**
 * Exception thrown when the x-rh-identity header is missing.
 */
public class MissingIdentityException extends RuntimeException {

    public MissingIdentityException(String message) {
        super(message);
    }
}
