package com.aiops.dataCollector.collector.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceLocationTest {

    @Test
    void resolveJoinsSegmentsWithSingleSlashes() {
        ServiceLocation location = new ServiceLocation("http://topology.local/", "/api/topological-inventory/v2.0/");

        assertThat(location.resolve("vms/1/tags"))
                .isEqualTo("http://topology.local/api/topological-inventory/v2.0/vms/1/tags");
    }

    @Test
    void resolveSkipsEmptyPath() {
        assertThat(new ServiceLocation("http://sources.local", "").resolve("/sources"))
                .isEqualTo("http://sources.local/sources");
    }

    @Test
    void linksAreRelativeToHost() {
        ServiceLocation location = new ServiceLocation("http://topology.local", "/api/v2.0");

        assertThat(location.resolveLink("/api/v2.0/vms?offset=100")).isEqualTo("http://topology.local/api/v2.0/vms?offset=100");
        assertThat(location.resolveLink("api/v2.0/vms?offset=100")).isEqualTo("http://topology.local/api/v2.0/vms?offset=100");
    }

    @Test
    void selectorNamesAreNormalized() {
        assertThat(ServiceSelector.fromName("topological-internal")).isEqualTo(ServiceSelector.TOPOLOGICAL_INTERNAL);
        assertThat(ServiceSelector.fromName("sources")).isEqualTo(ServiceSelector.SOURCES);
        assertThat(ServiceSelector.fromName("catalog")).isEqualTo(ServiceSelector.TOPOLOGICAL);
    }
}
