package com.aiops.dataCollector.collector.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of collecting every configured entity of a job.
 * Either complete, with one non-empty result per entity in catalog order,
 * or incomplete, naming the entity that yielded no records.
 */
public final class JobCollection {

    private final Map<String, CollectionResult> results;
    private final String emptyEntity;

    private JobCollection(Map<String, CollectionResult> results, String emptyEntity) {
        this.results = results;
        this.emptyEntity = emptyEntity;
    }

    public static JobCollection complete(Map<String, CollectionResult> results) {
        return new JobCollection(Collections.unmodifiableMap(new LinkedHashMap<>(results)), null);
    }

    public static JobCollection incomplete(String emptyEntity) {
        return new JobCollection(Map.of(), emptyEntity);
    }

    public boolean isComplete() {
        return emptyEntity == null && !results.isEmpty();
    }

    public Map<String, CollectionResult> results() {
        return results;
    }

    /**
     * Name of the entity that came back empty, null if none did.
     */
    public String emptyEntity() {
        return emptyEntity;
    }
}
