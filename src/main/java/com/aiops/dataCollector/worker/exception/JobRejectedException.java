package com.aiops.dataCollector.worker.exception;

/**
 * Exception thrown when the worker pool has no room for another job.
 */
public class JobRejectedException extends RuntimeException {

    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
