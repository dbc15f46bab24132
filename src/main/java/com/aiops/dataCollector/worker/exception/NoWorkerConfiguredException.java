package com.aiops.dataCollector.worker.exception;

/**
 * Exception thrown when a job arrives but no worker is set for this deployment.
 */
public class NoWorkerConfiguredException extends RuntimeException {

    public NoWorkerConfiguredException(String message) {
        super(message);
    }
}
