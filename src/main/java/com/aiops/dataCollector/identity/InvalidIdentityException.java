package com.aiops.dataCollector.identity;

/**
 * Exception thrown when an x-rh-identity blob cannot be decoded.
 */
public class InvalidIdentityException extends RuntimeException {

    public InvalidIdentityException(String message) {
        super(message);
    }

    public InvalidIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
