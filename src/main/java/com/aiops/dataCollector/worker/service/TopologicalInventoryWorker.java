package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.collector.model.JobCollection;
import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.collector.service.EntityCatalog;
import com.aiops.dataCollector.collector.service.EntityJoinEngine;
import com.aiops.dataCollector.collector.service.TenantIterator;
import com.aiops.dataCollector.forward.service.ForwardingSink;
import com.aiops.dataCollector.identity.AccountIdMasker;
import com.aiops.dataCollector.transport.exception.TransportException;
import com.aiops.dataCollector.worker.model.WorkerType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collects the active catalog entities for every tenant of a job and forwards them
 * as one {@code {entity name -> records}} payload per tenant.
 *
 * Tenants are processed one after the other. A tenant whose collection is incomplete,
 * or whose fetches failed, is not forwarded; the remaining tenants still run.
 * A tenant is marked processed after its payload was delivered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologicalInventoryWorker implements CollectorWorker {

    private final TenantIterator tenantIterator;
    private final EntityJoinEngine entityJoinEngine;
    private final EntityCatalog entityCatalog;
    private final ForwardingSink forwardingSink;
    private final ProcessedCache processedCache;

    @Override
    public WorkerType type() {
        return WorkerType.TOPOLOGICAL_INVENTORY;
    }

    @Override
    public void run(Job job) {
        List<TenantContext> tenants = tenantIterator.tenantsFor(job);
        log.debug("Collecting topological inventory - sourceId: {}, tenants: {}", job.sourceId(), tenants.size());

        int forwarded = 0;
        for (TenantContext tenant : tenants) {
            if (collectTenant(job, tenant)) {
                forwarded++;
            }
        }

        log.info("Topological inventory job finished - sourceId: {}, tenants: {}, forwarded: {}",
                job.sourceId(), tenants.size(), forwarded);
    }

    private boolean collectTenant(Job job, TenantContext tenant) {
        String account = AccountIdMasker.mask(tenant.accountId());

        JobCollection collection;
        try {
            collection = entityJoinEngine.collectJob(entityCatalog.activeEntities(), tenant.headers());
        } catch (TransportException e) {
            log.error("Unable to fetch source data - sourceId: {}, accountId: {}, error: {}",
                    job.sourceId(), account, e.getMessage());
            return false;
        }

        if (!collection.isComplete()) {
            log.info("Incomplete collection, nothing forwarded - sourceId: {}, accountId: {}, emptyEntity: {}",
                    job.sourceId(), account, collection.emptyEntity());
            return false;
        }

        boolean forwarded = forwardingSink.forward(job.sourceId(), collection.results(), job.destination(), tenant);
        if (forwarded && tenant.accountId() != null) {
            processedCache.markProcessed(tenant.accountId());
        }
        return forwarded;
    }
}
