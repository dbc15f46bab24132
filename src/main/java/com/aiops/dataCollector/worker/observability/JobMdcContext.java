package com.aiops.dataCollector.worker.observability;

import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.identity.AccountIdMasker;
import org.slf4j.MDC;

/**
 * Auto-closeable MDC scope for a running job.
 * Use with try-with-resources so that pool threads never carry a previous job's keys.
 *
 * <pre>
 * try (JobMdcContext mdc = new JobMdcContext(job, "host-inventory")) {
 *     log.info("Worker started"); // includes sourceId, accountId, worker
 * }
 * </pre>
 */
public class JobMdcContext implements AutoCloseable {

    public JobMdcContext(Job job, String worker) {
        MDC.put(MdcKeys.SOURCE_ID, job.sourceId());
        MDC.put(MdcKeys.WORKER, worker);
        if (job.accountId() != null) {
            MDC.put(MdcKeys.ACCOUNT_ID, AccountIdMasker.mask(job.accountId()));
        }
    }

    @Override
    public void close() {
        MDC.clear();
    }
}
