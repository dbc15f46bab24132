package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.worker.model.WorkerType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerRegistryTest {

    @Mock
    private CollectorWorker topological;

    @Mock
    private CollectorWorker hosts;

    @Test
    void selectsConfiguredWorker() {
        when(topological.type()).thenReturn(WorkerType.TOPOLOGICAL_INVENTORY);
        when(hosts.type()).thenReturn(WorkerType.HOST_INVENTORY);

        WorkerRegistry registry = new WorkerRegistry(List.of(topological, hosts), properties("host-inventory"));

        assertThat(registry.activeWorker()).containsSame(hosts);
    }

    @Test
    void unknownWorkerNameLeavesNoWorker() {
        when(topological.type()).thenReturn(WorkerType.TOPOLOGICAL_INVENTORY);

        WorkerRegistry registry = new WorkerRegistry(List.of(topological), properties("cost-management"));

        assertThat(registry.activeWorker()).isEmpty();
    }

    @Test
    void blankWorkerLeavesNoWorker() {
        when(topological.type()).thenReturn(WorkerType.TOPOLOGICAL_INVENTORY);

        assertThat(new WorkerRegistry(List.of(topological), properties("")).activeWorker()).isEmpty();
    }

    private static CollectorProperties properties(String worker) {
        CollectorProperties properties = new CollectorProperties();
        properties.setWorker(worker);
        return properties;
    }
}
