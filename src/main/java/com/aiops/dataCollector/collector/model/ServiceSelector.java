package com.aiops.dataCollector.collector.model;

import java.util.Locale;

/**
 * Backends able to serve entity collections.
 */
public enum ServiceSelector {
    SOURCES,
    TOPOLOGICAL,
    TOPOLOGICAL_INTERNAL;

    /**
     * Resolves a configured selector name. Unknown or missing names fall back to {@link #TOPOLOGICAL}.
     */
    public static ServiceSelector fromName(String name) {
        if (name == null || name.isBlank()) {
            return TOPOLOGICAL;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ServiceSelector selector : values()) {
            if (selector.name().equals(normalized)) {
                return selector;
            }
        }
        return TOPOLOGICAL;
    }
}
