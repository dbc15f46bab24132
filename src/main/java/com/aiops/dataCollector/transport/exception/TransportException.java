package com.aiops.dataCollector.transport.exception;

/**
 * Base exception for outbound HTTP calls that produced no usable response.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
