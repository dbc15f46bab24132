package com.aiops.dataCollector.collector.model;

import lombok.Builder;

import java.util.UUID;

/**
 * A collection request handed to the worker pool.
 *
 * @param sourceRef Data source location (URL), may be null when the worker knows its sources
 * @param sourceId Data identifier echoed downstream as the envelope id
 * @param destination Location where the collected data is posted
 * @param tenantContext Requesting tenant, may be null
 */
@Builder(toBuilder = true)
public record Job(String sourceRef, String sourceId, String destination, TenantContext tenantContext) {

    /**
     * Returns this job with a generated source id when none was supplied.
     */
    public Job withDefaultSourceId() {
        if (sourceId != null && !sourceId.isBlank()) {
            return this;
        }
        return toBuilder().sourceId(UUID.randomUUID().toString()).build();
    }

    public Integer accountId() {
        return tenantContext == null ? null : tenantContext.accountId();
    }
}
