package com.aiops.dataCollector.transport.exception;

import lombok.Getter;
import org.springframework.http.HttpMethod;

/**
 * Exception thrown when every attempt of an HTTP call failed.
 */
@Getter
public class TransportExhaustedException extends TransportException {

    private final HttpMethod method;
    private final String url;
    private final int attempts;

    public TransportExhaustedException(HttpMethod method, String url, int attempts, Throwable lastFailure) {
        super("All " + attempts + " attempts failed for " + method + " " + url, lastFailure);
        this.method = method;
        this.url = url;
        this.attempts = attempts;
    }
}
