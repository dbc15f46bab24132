package com.aiops.dataCollector.forward.service;

import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.forward.dto.ForwardEnvelope;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.transport.exception.TransportException;
import com.aiops.dataCollector.transport.service.Transport;
import com.aiops.dataCollector.transport.util.HttpUrls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Posts collected payloads to the downstream service.
 *
 * Delivery is at most once: a post that fails on every transport attempt is logged,
 * counted and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForwardingSink {

    private final Transport transport;
    private final CollectorMetrics metrics;

    /**
     * Wraps the payload into {@code {id, data}} and posts it.
     *
     * @param sourceId Envelope id
     * @param payload Collected data
     * @param destination Downstream URL; a bare host is posted to over http
     * @param tenant Tenant whose identity is attached as x-rh-identity, may be null
     * @return true if the downstream service accepted the payload
     */
    public boolean forward(String sourceId, Object payload, String destination, TenantContext tenant) {
        ForwardEnvelope envelope = new ForwardEnvelope(sourceId, payload);
        Map<String, String> headers = tenant != null ? tenant.headers() : Map.of();
        String url = HttpUrls.withDefaultScheme(destination);

        metrics.postAttempted();
        try {
            transport.post(url, headers, envelope);
        } catch (TransportException e) {
            log.error("Failed to pass data - sourceId: {}, destination: {}, error: {}", sourceId, url, e.getMessage());
            metrics.postFailed();
            return false;
        }

        metrics.postSucceeded();
        log.info("Data passed to next service - sourceId: {}, destination: {}", sourceId, url);
        return true;
    }
}
