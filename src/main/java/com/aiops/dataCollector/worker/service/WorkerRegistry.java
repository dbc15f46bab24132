package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.worker.model.WorkerType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the worker configured for this deployment through {@code collector.worker}.
 */
@Slf4j
@Component
public class WorkerRegistry {

    private final CollectorWorker activeWorker;

    public WorkerRegistry(List<CollectorWorker> workers, CollectorProperties properties) {
        Map<WorkerType, CollectorWorker> byType = new EnumMap<>(WorkerType.class);
        workers.forEach(worker -> byType.put(worker.type(), worker));

        Optional<WorkerType> configured = WorkerType.fromConfigName(properties.getWorker());
        this.activeWorker = configured.map(byType::get).orElse(null);

        if (activeWorker == null) {
            log.warn("No worker set - collector.worker: '{}', available: {}", properties.getWorker(), byType.keySet());
        } else {
            log.info("Active worker - type: {}", activeWorker.type().getConfigName());
        }
    }

    public Optional<CollectorWorker> activeWorker() {
        return Optional.ofNullable(activeWorker);
    }
}
