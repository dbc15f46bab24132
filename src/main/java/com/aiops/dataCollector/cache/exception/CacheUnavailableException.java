package com.aiops.dataCollector.cache.exception;

/**
 * Exception thrown when the processed-accounts store cannot be reached.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
