package com.aiops.dataCollector.gateway.service;

import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.gateway.dto.StatusResponse;
import com.aiops.dataCollector.transport.service.Transport;
import com.aiops.dataCollector.transport.util.HttpUrls;
import com.aiops.dataCollector.worker.service.WorkerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reports whether the collector can do useful work: a worker is set, and both the
 * next service and the processed cache answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    private final WorkerRegistry workerRegistry;
    private final Transport transport;
    private final ProcessedCache processedCache;
    private final CollectorProperties properties;

    public StatusResponse check() {
        if (workerRegistry.activeWorker().isEmpty()) {
            return StatusResponse.error("Error", "No worker set");
        }
        if (!(nextServiceAvailable() && cacheAvailable())) {
            return StatusResponse.error("Error", "Required service not operational");
        }
        return StatusResponse.ok("Up and Running");
    }

    private boolean nextServiceAvailable() {
        String nextService = properties.getNextServiceUrl();
        if (nextService == null || nextService.isBlank()) {
            log.debug("Next service not configured");
            return false;
        }
        boolean available = transport.ping(HttpUrls.withDefaultScheme(nextService).replaceAll("/+$", "") + "/ping");
        if (!available) {
            log.debug("Next service not available");
        }
        return available;
    }

    private boolean cacheAvailable() {
        boolean available = processedCache.ping();
        if (!available) {
            log.debug("Processed cache not available");
        }
        return available;
    }
}
