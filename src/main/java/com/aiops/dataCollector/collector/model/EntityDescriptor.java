package com.aiops.dataCollector.collector.model;

import lombok.Builder;

/**
 * Configuration unit naming a main collection, an optional dependent sub-collection,
 * the foreign key relating them and the backend serving them.
 *
 * @param mainCollection Top-level collection path
 * @param subCollection Per-parent nested collection, fetched as {@code main/{id}/sub}
 * @param foreignKey Field receiving the parent id in every sub-record
 * @param serviceSelector Backend name, see {@link ServiceSelector#fromName(String)}
 */
@Builder
public record EntityDescriptor(String mainCollection, String subCollection, String foreignKey, String serviceSelector) {

    public static EntityDescriptor mainOnly(String mainCollection, String serviceSelector) {
        return new EntityDescriptor(mainCollection, null, null, serviceSelector);
    }

    /**
     * True when any of the sub-collection fields is set.
     */
    public boolean requestsSubCollection() {
        return isPresent(subCollection) || isPresent(foreignKey);
    }

    public ServiceSelector selector() {
        return ServiceSelector.fromName(serviceSelector);
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
