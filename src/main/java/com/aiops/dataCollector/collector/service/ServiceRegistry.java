package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.collector.model.ServiceLocation;
import com.aiops.dataCollector.collector.model.ServiceSelector;
import com.aiops.dataCollector.config.CollectorProperties;
import org.springframework.stereotype.Component;

/**
 * Static table of backend locations, keyed by {@link ServiceSelector}.
 */
@Component
public class ServiceRegistry {

    private final ServiceLocation sources;
    private final ServiceLocation topological;
    private final ServiceLocation topologicalInternal;

    public ServiceRegistry(CollectorProperties properties) {
        CollectorProperties.Services services = properties.getServices();
        this.sources = toLocation(services.getSources());
        this.topological = toLocation(services.getTopological());
        this.topologicalInternal = toLocation(services.getTopologicalInternal());
    }

    public ServiceLocation locate(ServiceSelector selector) {
        if (selector == null) {
            return topological;
        }
        return switch (selector) {
            case SOURCES -> sources;
            case TOPOLOGICAL_INTERNAL -> topologicalInternal;
            case TOPOLOGICAL -> topological;
        };
    }

    private static ServiceLocation toLocation(CollectorProperties.Location location) {
        return new ServiceLocation(location.getHost(), location.getPath());
    }
}
