package com.aiops.dataCollector.gateway.service;

import com.aiops.dataCollector.cache.exception.CacheUnavailableException;
import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.gateway.dto.CollectRequest;
import com.aiops.dataCollector.gateway.dto.StatusResponse;
import com.aiops.dataCollector.gateway.exception.MissingIdentityException;
import com.aiops.dataCollector.identity.AccountIdMasker;
import com.aiops.dataCollector.identity.IdentityCodec;
import com.aiops.dataCollector.identity.InvalidIdentityException;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.worker.exception.JobRejectedException;
import com.aiops.dataCollector.worker.exception.NoWorkerConfiguredException;
import com.aiops.dataCollector.worker.service.JobDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gateway service - turns an ingress request into a dispatched job.
 *
 * Responsibilities:
 * - Decode the account from the x-rh-identity header
 * - Skip accounts processed within the processing window
 * - Hand the job to the dispatcher without waiting for it
 *
 * The processed check and the worker's marking are not atomic: two requests for the same
 * account arriving together can both be dispatched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final ProcessedCache processedCache;
    private final JobDispatcher jobDispatcher;
    private final CollectorProperties properties;
    private final CollectorMetrics metrics;

    /**
     * @param request Collect request body, may be null
     * @param identityHeader Raw x-rh-identity header value
     * @return Status telling whether the job was started or skipped
     * @throws MissingIdentityException if the header is absent
     * @throws InvalidIdentityException if the header cannot be decoded
     * @throws CacheUnavailableException if the processed state cannot be read
     * @throws NoWorkerConfiguredException if no worker is set
     * @throws JobRejectedException if the worker pool is saturated
     */
    public StatusResponse collect(CollectRequest request, String identityHeader) {
        metrics.jobReceived();

        if (identityHeader == null || identityHeader.isBlank()) {
            metrics.jobDenied();
            throw new MissingIdentityException("Missing '" + IdentityCodec.HEADER + "' header");
        }

        Integer accountId;
        try {
            accountId = IdentityCodec.decodeAccountId(identityHeader);
        } catch (InvalidIdentityException e) {
            metrics.jobDenied();
            throw e;
        }
        log.debug("Collect request received - accountId: {}", AccountIdMasker.mask(accountId));

        if (accountId != null && processedCache.processed(accountId)) {
            log.info("Account processed before, skipping - accountId: {}", AccountIdMasker.mask(accountId));
            return StatusResponse.ok("Account processed before");
        }

        CollectRequest body = request != null ? request : new CollectRequest();
        Job job = Job.builder()
                .sourceRef(body.getUrl())
                .sourceId(body.getPayloadId())
                .destination(properties.getNextServiceUrl())
                .tenantContext(new TenantContext(accountId, identityHeader.trim()))
                .build();

        String sourceId = jobDispatcher.dispatch(job);
        log.info("Job initiated - sourceId: {}, accountId: {}", sourceId, AccountIdMasker.mask(accountId));
        return StatusResponse.ok("Job initiated");
    }
}
