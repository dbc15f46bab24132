package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.collector.exception.ConfigurationException;
import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.collector.service.PaginatedFetcher;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.forward.service.ForwardingSink;
import com.aiops.dataCollector.identity.AccountIdMasker;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.transport.exception.TransportException;
import com.aiops.dataCollector.worker.model.WorkerType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Downloads every host of the requesting account from a count-paginated inventory
 * and forwards them as a single collection.
 */
@Slf4j
@Component
public class HostInventoryWorker implements CollectorWorker {

    private final PaginatedFetcher paginatedFetcher;
    private final ForwardingSink forwardingSink;
    private final ProcessedCache processedCache;
    private final CollectorMetrics metrics;
    private final String defaultUrl;

    public HostInventoryWorker(PaginatedFetcher paginatedFetcher, ForwardingSink forwardingSink,
                               ProcessedCache processedCache, CollectorMetrics metrics,
                               CollectorProperties properties) {
        this.paginatedFetcher = paginatedFetcher;
        this.forwardingSink = forwardingSink;
        this.processedCache = processedCache;
        this.metrics = metrics;
        this.defaultUrl = properties.getHostInventory().getUrl();
    }

    @Override
    public WorkerType type() {
        return WorkerType.HOST_INVENTORY;
    }

    @Override
    public void run(Job job) {
        String url = job.sourceRef() != null && !job.sourceRef().isBlank() ? job.sourceRef() : defaultUrl;
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("No source URL given and collector.host-inventory.url is not set");
        }

        TenantContext tenant = job.tenantContext() != null ? job.tenantContext() : TenantContext.anonymous();
        String account = AccountIdMasker.mask(tenant.accountId());

        metrics.getAttempted();
        CollectionResult hosts;
        try {
            hosts = paginatedFetcher.fetchCounted(url, tenant.headers());
        } catch (TransportException e) {
            metrics.getFailed();
            log.error("Unable to fetch source data - sourceId: {}, accountId: {}, error: {}",
                    job.sourceId(), account, e.getMessage());
            return;
        }
        metrics.getSucceeded();
        log.debug("Hosts received - sourceId: {}, accountId: {}, hosts: {}", job.sourceId(), account, hosts.size());

        boolean forwarded = forwardingSink.forward(job.sourceId(), hosts, job.destination(), tenant);
        if (forwarded && tenant.accountId() != null) {
            processedCache.markProcessed(tenant.accountId());
        }
    }
}
