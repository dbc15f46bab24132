package com.aiops.dataCollector.worker.model;

import java.util.Optional;

/**
 * Collection workers a deployment can run.
 */
public enum WorkerType {
    TOPOLOGICAL_INVENTORY("topological-inventory"),
    HOST_INVENTORY("host-inventory");

    private final String configName;

    WorkerType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static Optional<WorkerType> fromConfigName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (WorkerType type : values()) {
            if (type.configName.equalsIgnoreCase(name.trim()) || type.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
