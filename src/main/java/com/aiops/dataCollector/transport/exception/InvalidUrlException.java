package com.aiops.dataCollector.transport.exception;

import lombok.Getter;

/**
 * Exception thrown when a call targets a URL that is not an absolute http(s) URL.
 * No request is sent.
 */
@Getter
public class InvalidUrlException extends TransportException {

    private final String url;

    public InvalidUrlException(String url, String reason) {
        super("Invalid URL '" + url + "': " + reason);
        this.url = url;
    }

    public InvalidUrlException(String url, Throwable cause) {
        super("Invalid URL '" + url + "': " + cause.getMessage(), cause);
        this.url = url;
    }
}
