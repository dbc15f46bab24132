package com.aiops.dataCollector.transport.service;

import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.transport.exception.InvalidUrlException;
import com.aiops.dataCollector.transport.exception.TransportException;
import com.aiops.dataCollector.transport.exception.TransportExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.function.Function;

/**
 * Retrying HTTP execution primitive underlying every network call of the collector.
 *
 * A call is attempted up to {@code collector.http.max-retries} times. Error statuses and
 * connection failures trigger an immediate new attempt; the first 2xx response is returned
 * whatever its content type. Response bodies are handed back as text, callers parse them.
 */
@Slf4j
@Service
public class Transport {

    private final RestClient restClient;
    private final int maxRetries;

    public Transport(RestClient collectorRestClient, CollectorProperties properties) {
        this.restClient = collectorRestClient;
        this.maxRetries = properties.getHttp().getMaxRetries();
    }

    /**
     * @return First successful response; the body is null when the server sent none
     */
    public ResponseEntity<String> get(String url, Map<String, String> headers) {
        return execute(HttpMethod.GET, url, headers, null, response -> response.toEntity(String.class));
    }

    /**
     * Posts a JSON body. The response body is discarded.
     */
    public ResponseEntity<Void> post(String url, Map<String, String> headers, Object body) {
        return execute(HttpMethod.POST, url, headers, body, RestClient.ResponseSpec::toBodilessEntity);
    }

    /**
     * Executes a single HTTP call with the retry budget.
     *
     * @param method HTTP method
     * @param url Absolute http(s) URL
     * @param headers Optional request headers
     * @param body Optional body, serialized as JSON
     * @param extractor Reads the successful response
     * @return First successful response
     * @throws InvalidUrlException if the URL is not an absolute http(s) URL; nothing is sent
     * @throws TransportExhaustedException when every attempt failed
     */
    public <T> ResponseEntity<T> execute(HttpMethod method, String url, Map<String, String> headers, Object body,
                                         Function<RestClient.ResponseSpec, ResponseEntity<T>> extractor) {
        URI uri = toUri(url);
        RestClientException lastFailure = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                RestClient.RequestBodySpec request = restClient.method(method)
                        .uri(uri)
                        .headers(httpHeaders -> {
                            if (headers != null) {
                                headers.forEach(httpHeaders::set);
                            }
                        });
                if (body != null) {
                    request.body(body);
                }
                return extractor.apply(request.retrieve());
            } catch (RestClientException e) {
                lastFailure = e;
                log.warn("Request failed (attempt #{}), retrying - method: {}, url: {}, error: {}",
                        attempt, method, url, e.getMessage());
            }
        }

        throw new TransportExhaustedException(method, url, maxRetries, lastFailure);
    }

    /**
     * Checks that a service answers a GET with a 2xx status within the retry budget.
     *
     * @param url URL to check
     * @return true if a successful response was received
     */
    public boolean ping(String url) {
        try {
            execute(HttpMethod.GET, url, null, null, RestClient.ResponseSpec::toBodilessEntity);
            return true;
        } catch (TransportException e) {
            log.debug("Service not available - url: {}, error: {}", url, e.getMessage());
            return false;
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException(String.valueOf(url), "URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new InvalidUrlException(url, "scheme must be http or https");
        }
        if (uri.getHost() == null) {
            throw new InvalidUrlException(url, "no host");
        }
        return uri;
    }
}
