package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.collector.exception.ConfigurationException;
import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.DataRecord;
import com.aiops.dataCollector.collector.model.EntityDescriptor;
import com.aiops.dataCollector.collector.model.JobCollection;
import com.aiops.dataCollector.collector.model.ServiceLocation;
import com.aiops.dataCollector.collector.model.ServiceSelector;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.transport.exception.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves entity descriptors into fully joined record sets.
 *
 * Handles:
 * - Selecting the backend serving a descriptor
 * - Main-only collections
 * - Main/sub-collection joins with foreign key injection
 * - Collecting every active catalog entry of a job, all or nothing
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityJoinEngine {

    private final PaginatedFetcher paginatedFetcher;
    private final ServiceRegistry serviceRegistry;
    private final EntityCatalog entityCatalog;
    private final CollectorMetrics metrics;

    /**
     * Resolves a descriptor into its record set.
     *
     * @param descriptor Entity to resolve
     * @param headers Request headers, may be null
     * @return Main collection, or the joined sub-collection when one is requested
     * @throws ConfigurationException if the descriptor misses fields required by its shape; no call is made
     */
    public CollectionResult resolve(EntityDescriptor descriptor, Map<String, String> headers) {
        return resolve(descriptor, headers, new HashMap<>());
    }

    /**
     * Collects the given catalog entries in order.
     * Stops at the first entry yielding no records: partial payloads are never produced.
     *
     * @param entityNames Ordered catalog entry names
     * @param headers Request headers, may be null
     * @return Complete collection keyed by entry name, or an incomplete marker
     * @throws ConfigurationException if an entry is unknown or misconfigured
     * @throws TransportException if a fetch failed on every attempt or targets an invalid URL
     */
    public JobCollection collectJob(List<String> entityNames, Map<String, String> headers) {
        if (entityNames == null || entityNames.isEmpty()) {
            log.info("No entities configured for collection");
            return JobCollection.incomplete(null);
        }

        Map<String, CollectionResult> mainCollections = new HashMap<>();
        Map<String, CollectionResult> results = new LinkedHashMap<>();

        for (String name : entityNames) {
            EntityDescriptor descriptor = entityCatalog.get(name);

            metrics.getAttempted();
            CollectionResult result;
            try {
                result = resolve(descriptor, headers, mainCollections);
            } catch (TransportException e) {
                metrics.getFailed();
                throw e;
            }
            metrics.getSucceeded();

            if (result.isEmpty()) {
                log.info("Entity collection is empty, nothing will be forwarded - entity: {}", name);
                return JobCollection.incomplete(name);
            }

            log.debug("Entity collected - entity: {}, records: {}", name, result.size());
            results.put(name, result);
        }

        return JobCollection.complete(results);
    }

    private CollectionResult resolve(EntityDescriptor descriptor, Map<String, String> headers,
                                     Map<String, CollectionResult> mainCollections) {
        validate(descriptor);

        ServiceSelector selector = descriptor.selector();
        ServiceLocation location = serviceRegistry.locate(selector);

        CollectionResult main = mainCollections.get(selector + ":" + descriptor.mainCollection());
        if (main == null) {
            main = paginatedFetcher.fetchLinked(location, descriptor.mainCollection(), headers);
            mainCollections.put(selector + ":" + descriptor.mainCollection(), main);
        }

        if (!descriptor.requestsSubCollection()) {
            return main;
        }
        return joinSubCollection(descriptor, location, main, headers);
    }

    private CollectionResult joinSubCollection(EntityDescriptor descriptor, ServiceLocation location,
                                               CollectionResult main, Map<String, String> headers) {
        CollectionResult.Builder joined = CollectionResult.builder();

        for (DataRecord parent : main) {
            Object parentId = parent.id();
            if (parentId == null) {
                throw new IllegalStateException("Record of " + descriptor.mainCollection() + " has no id: " + parent);
            }

            String path = descriptor.mainCollection() + "/" + parentId + "/" + descriptor.subCollection();
            for (DataRecord child : paginatedFetcher.fetchLinked(location, path, headers)) {
                joined.add(child.with(descriptor.foreignKey(), parentId));
            }
        }

        return joined.build();
    }

    private static void validate(EntityDescriptor descriptor) {
        if (descriptor == null) {
            throw new ConfigurationException("Entity descriptor is missing");
        }
        if (isBlank(descriptor.mainCollection())) {
            throw new ConfigurationException("Entity descriptor has no mainCollection: " + descriptor);
        }
        if (descriptor.requestsSubCollection()
                && (isBlank(descriptor.subCollection()) || isBlank(descriptor.foreignKey()))) {
            throw new ConfigurationException(
                    "Sub-collection entity requires mainCollection, subCollection and foreignKey: " + descriptor);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
