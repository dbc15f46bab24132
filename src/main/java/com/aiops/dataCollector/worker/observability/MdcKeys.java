package com.aiops.dataCollector.worker.observability;

/**
 * MDC keys set while a job runs.
 */
public final class MdcKeys {
    public static final String SOURCE_ID = "sourceId";
    public static final String ACCOUNT_ID = "accountId";
    public static final String WORKER = "worker";

    private MdcKeys() {
        throw new UnsupportedOperationException("Utility class");
    }
}
