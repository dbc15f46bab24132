package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.collector.exception.ConfigurationException;
import com.aiops.dataCollector.collector.model.EntityDescriptor;
import com.aiops.dataCollector.config.CollectorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named entity descriptors and the ordered list of entries active for this deployment.
 * Loaded once from configuration, read-only afterwards.
 */
@Slf4j
@Component
public class EntityCatalog {

    private final Map<String, EntityDescriptor> descriptors;
    private final List<String> activeEntities;

    public EntityCatalog(CollectorProperties properties) {
        Map<String, EntityDescriptor> loaded = new LinkedHashMap<>();
        properties.getEntities().forEach((name, entity) -> loaded.put(name, EntityDescriptor.builder()
                .mainCollection(entity.getMainCollection())
                .subCollection(entity.getSubCollection())
                .foreignKey(entity.getForeignKey())
                .serviceSelector(entity.getService())
                .build()));
        this.descriptors = Collections.unmodifiableMap(loaded);
        this.activeEntities = List.copyOf(properties.getActiveEntities());

        log.info("Entity catalog loaded - entities: {}, active: {}", descriptors.keySet(), activeEntities);
    }

    /**
     * @param name Catalog entry name
     * @return The descriptor registered under {@code name}
     * @throws ConfigurationException if no such entry exists
     */
    public EntityDescriptor get(String name) {
        EntityDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new ConfigurationException("Unknown entity in catalog: " + name);
        }
        return descriptor;
    }

    public List<String> activeEntities() {
        return activeEntities;
    }
}
