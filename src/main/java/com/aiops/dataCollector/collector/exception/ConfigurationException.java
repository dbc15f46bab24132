package com.aiops.dataCollector.collector.exception;

/**
 * Exception thrown when an entity descriptor or catalog entry cannot be used as configured.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
