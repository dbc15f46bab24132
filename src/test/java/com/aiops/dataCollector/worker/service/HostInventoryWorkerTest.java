package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.cache.service.ProcessedCache;
import com.aiops.dataCollector.collector.exception.ConfigurationException;
import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.DataRecord;
import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.collector.model.TenantContext;
import com.aiops.dataCollector.collector.service.PaginatedFetcher;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.forward.service.ForwardingSink;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.transport.exception.TransportExhaustedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HostInventoryWorkerTest {

    private static final String DEFAULT_URL = "http://inventory.local/api/inventory/v1/hosts";

    @Mock
    private PaginatedFetcher paginatedFetcher;

    @Mock
    private ForwardingSink forwardingSink;

    @Mock
    private ProcessedCache processedCache;

    private SimpleMeterRegistry meterRegistry;
    private HostInventoryWorker worker;
    private TenantContext tenant;

    @BeforeEach
    void setUp() {
        CollectorProperties properties = new CollectorProperties();
        properties.getHostInventory().setUrl(DEFAULT_URL);
        meterRegistry = new SimpleMeterRegistry();
        worker = new HostInventoryWorker(paginatedFetcher, forwardingSink, processedCache,
                new CollectorMetrics(meterRegistry), properties);
        tenant = TenantContext.forAccount(42);
    }

    @Test
    void forwardsHostsAndMarksAccountAfterDelivery() {
        CollectionResult hosts = CollectionResult.of(List.of(new DataRecord(Map.of("id", "h1"))));
        Job job = job("http://inventory.local/custom/hosts");
        when(paginatedFetcher.fetchCounted("http://inventory.local/custom/hosts", tenant.headers())).thenReturn(hosts);
        when(forwardingSink.forward("src-1", hosts, "http://next.local", tenant)).thenReturn(true);

        worker.run(job);

        verify(processedCache).markProcessed(42);
        assertThat(meterRegistry.get("collector.get.successes").counter().count()).isEqualTo(1.0);
    }

    @Test
    void fallsBackToConfiguredUrl() {
        when(paginatedFetcher.fetchCounted(DEFAULT_URL, tenant.headers())).thenReturn(CollectionResult.empty());
        when(forwardingSink.forward("src-1", CollectionResult.empty(), "http://next.local", tenant)).thenReturn(true);

        worker.run(job(null));

        verify(paginatedFetcher).fetchCounted(DEFAULT_URL, tenant.headers());
    }

    @Test
    void failedDeliveryLeavesAccountUnmarked() {
        when(paginatedFetcher.fetchCounted(DEFAULT_URL, tenant.headers())).thenReturn(CollectionResult.empty());
        when(forwardingSink.forward(anyString(), any(), anyString(), any())).thenReturn(false);

        worker.run(job(""));

        verify(processedCache, never()).markProcessed(anyInt());
    }

    @Test
    void failedFetchForwardsNothing() {
        when(paginatedFetcher.fetchCounted(DEFAULT_URL, tenant.headers())).thenThrow(
                new TransportExhaustedException(HttpMethod.GET, DEFAULT_URL, 3, new RuntimeException("down")));

        worker.run(job(null));

        verifyNoInteractions(forwardingSink, processedCache);
        assertThat(meterRegistry.get("collector.get.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    void missingSourceUrlIsConfigurationError() {
        CollectorProperties properties = new CollectorProperties();
        HostInventoryWorker unconfigured = new HostInventoryWorker(paginatedFetcher, forwardingSink, processedCache,
                new CollectorMetrics(meterRegistry), properties);

        assertThatThrownBy(() -> unconfigured.run(job(null))).isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(paginatedFetcher);
    }

    private Job job(String sourceRef) {
        return Job.builder()
                .sourceRef(sourceRef)
                .sourceId("src-1")
                .destination("http://next.local")
                .tenantContext(tenant)
                .build();
    }
}
