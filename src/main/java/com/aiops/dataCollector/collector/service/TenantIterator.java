package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.DataRecord;
import com.aiops.dataCollector.collector.model.EntityDescriptor;
import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.collector.model.ServiceSelector;
import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.identity.AccountIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands a job into the tenants it is collected for.
 *
 * Single-tenant mode uses the job's own tenant; the worker marks it processed once its data
 * was delivered. All-tenants mode enumerates the tenants known to the internal backend and marks
 * each one processed as soon as it is enumerated, before its collection runs.
 */
@Slf4j
@Service
public class TenantIterator {

    static final EntityDescriptor TENANTS =
            EntityDescriptor.mainOnly("tenants", ServiceSelector.TOPOLOGICAL_INTERNAL.name());

    private static final String EXTERNAL_TENANT = "external_tenant";
    private static final String EXTERNAL_TENANT_ALIAS = "externalTenant";

    private final EntityJoinEngine entityJoinEngine;
    private final ProcessedCache processedCache;
    private final boolean allTenants;

    public TenantIterator(EntityJoinEngine entityJoinEngine, ProcessedCache processedCache,
                          CollectorProperties properties) {
        this.entityJoinEngine = entityJoinEngine;
        this.processedCache = processedCache;
        this.allTenants = properties.isAllTenants();
    }

    /**
     * @param job Job being executed
     * @return Tenants to collect, in processing order; never empty in single-tenant mode
     */
    public List<TenantContext> tenantsFor(Job job) {
        if (allTenants) {
            return allKnownTenants(job);
        }

        TenantContext tenant = job.tenantContext() != null ? job.tenantContext() : TenantContext.anonymous();
        log.debug("Single tenant selected - sourceId: {}, accountId: {}", job.sourceId(), AccountIdMasker.mask(tenant.accountId()));
        return List.of(tenant);
    }

    private List<TenantContext> allKnownTenants(Job job) {
        TenantContext requestingTenant = job.tenantContext() != null ? job.tenantContext() : TenantContext.anonymous();
        CollectionResult records = entityJoinEngine.resolve(TENANTS, requestingTenant.headers());

        List<TenantContext> tenants = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            Integer accountId = externalTenant(record);
            if (accountId == null) {
                log.warn("Tenant record without external tenant skipped - sourceId: {}, record id: {}",
                        job.sourceId(), record.id());
                continue;
            }
            tenants.add(TenantContext.forAccount(accountId));
            processedCache.markProcessed(accountId);
        }

        log.info("Tenants enumerated - sourceId: {}, tenants: {}", job.sourceId(), tenants.size());
        return tenants;
    }

    private static Integer externalTenant(DataRecord record) {
        Object value = record.has(EXTERNAL_TENANT) ? record.get(EXTERNAL_TENANT) : record.get(EXTERNAL_TENANT_ALIAS);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            long accountId = number.longValue();
            if (accountId != number.doubleValue() || accountId < Integer.MIN_VALUE || accountId > Integer.MAX_VALUE) {
                log.warn("External tenant is not a valid account number - value: {}", value);
                return null;
            }
            return (int) accountId;
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("External tenant is not numeric - value: {}", value);
            return null;
        }
    }
}
