package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.DataRecord;
import com.aiops.dataCollector.collector.model.ServiceLocation;
import com.aiops.dataCollector.transport.exception.TransportExhaustedException;
import com.aiops.dataCollector.transport.service.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaginatedFetcherTest {

    private static final ServiceLocation TOPOLOGY = new ServiceLocation("http://topology.local", "/api/v1");
    private static final Map<String, String> HEADERS = Map.of("x-rh-identity", "blob");

    @Mock
    private Transport transport;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PaginatedFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new PaginatedFetcher(transport, objectMapper);
    }

    @Test
    void linkedSinglePageWithoutNext() {
        when(transport.get("http://topology.local/api/v1/volumes", HEADERS))
                .thenReturn(json("{\"data\": [{\"id\": \"1\"}, {\"id\": \"2\"}], \"links\": {}}"));

        CollectionResult result = fetcher.fetchLinked(TOPOLOGY, "volumes", HEADERS);

        assertThat(ids(result)).containsExactly("1", "2");
    }

    @Test
    void linkedFollowsNextRelativeToHost() {
        when(transport.get("http://topology.local/api/v1/volumes", HEADERS))
                .thenReturn(json("{\"data\": [{\"id\": \"1\"}], \"links\": {\"next\": \"/api/v1/volumes?offset=1\"}}"));
        when(transport.get("http://topology.local/api/v1/volumes?offset=1", HEADERS))
                .thenReturn(json("{\"data\": [{\"id\": \"2\"}], \"links\": {\"next\": null}}"));

        CollectionResult result = fetcher.fetchLinked(TOPOLOGY, "volumes", HEADERS);

        assertThat(ids(result)).containsExactly("1", "2");
    }

    @Test
    void linkedAcceptsBareArray() {
        when(transport.get("http://topology.local/api/v1/vms/7/tags", null))
                .thenReturn(json("[{\"tag\": \"a\"}, {\"tag\": \"b\"}]"));

        CollectionResult result = fetcher.fetchLinked(TOPOLOGY, "vms/7/tags", null);

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.records().get(1).get("tag")).isEqualTo("b");
    }

    @Test
    void linkedEmptyCollection() {
        when(transport.get(anyString(), any())).thenReturn(json("{\"data\": [], \"links\": {}}"));

        assertThat(fetcher.fetchLinked(TOPOLOGY, "volumes", null).isEmpty()).isTrue();
    }

    @Test
    void countedFetchesEveryPageIncludingTheLast() {
        when(transport.get("http://inventory.local/hosts?page=1", HEADERS))
                .thenReturn(json(countedPage(0, 10)));
        when(transport.get("http://inventory.local/hosts?page=2", HEADERS))
                .thenReturn(json(countedPage(10, 10)));
        when(transport.get("http://inventory.local/hosts?page=3", HEADERS))
                .thenReturn(json(countedPage(20, 5)));

        CollectionResult result = fetcher.fetchCounted("http://inventory.local/hosts", HEADERS);

        assertThat(result.size()).isEqualTo(25);
        assertThat(result.records().get(0).id()).isEqualTo(0);
        assertThat(result.records().get(24).id()).isEqualTo(24);
        verify(transport, never()).get("http://inventory.local/hosts?page=4", HEADERS);
    }

    @Test
    void countedExactMultipleStopsAtLastFullPage() {
        when(transport.get("http://inventory.local/hosts?page=1", null)).thenReturn(json(countedPage(0, 10, 20)));
        when(transport.get("http://inventory.local/hosts?page=2", null)).thenReturn(json(countedPage(10, 10, 20)));

        CollectionResult result = fetcher.fetchCounted("http://inventory.local/hosts", null);

        assertThat(result.size()).isEqualTo(20);
    }

    @Test
    void countedWithoutPageSizeIsSinglePage() {
        when(transport.get("http://inventory.local/hosts?page=1", null))
                .thenReturn(json("{\"results\": [{\"id\": 1}], \"total\": 40}"));

        CollectionResult result = fetcher.fetchCounted("http://inventory.local/hosts", null);

        assertThat(result.size()).isEqualTo(1);
    }

    @Test
    void countedAcceptsCamelCasePageSize() {
        when(transport.get("http://inventory.local/hosts?page=1", null))
                .thenReturn(json("{\"results\": [{\"id\": 1}], \"total\": 2, \"perPage\": 1}"));
        when(transport.get("http://inventory.local/hosts?page=2", null))
                .thenReturn(json("{\"results\": [{\"id\": 2}], \"total\": 2, \"perPage\": 1}"));

        assertThat(fetcher.fetchCounted("http://inventory.local/hosts", null).size()).isEqualTo(2);
    }

    @Test
    void pageParameterIsAddedNextToExistingQuery() {
        assertThat(PaginatedFetcher.pageUrl("http://inventory.local/hosts?staleness=fresh", 2))
                .isEqualTo("http://inventory.local/hosts?staleness=fresh&page=2");
        assertThat(PaginatedFetcher.pageUrl("http://inventory.local/hosts?page=1", 3))
                .isEqualTo("http://inventory.local/hosts?page=3");
    }

    @Test
    void rejectsNonObjectItems() {
        when(transport.get(anyString(), any())).thenReturn(json("{\"data\": [1, 2], \"links\": {}}"));

        assertThatThrownBy(() -> fetcher.fetchLinked(TOPOLOGY, "volumes", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Expected record objects");
    }

    @Test
    void rejectsEmptyBody() {
        when(transport.get(anyString(), any())).thenReturn(ResponseEntity.ok().build());

        assertThatThrownBy(() -> fetcher.fetchCounted("http://inventory.local/hosts", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Empty response body");
    }

    @Test
    void rejectsBodyThatIsNotJson() {
        when(transport.get(anyString(), any())).thenReturn(json("<html>maintenance</html>"));

        assertThatThrownBy(() -> fetcher.fetchLinked(TOPOLOGY, "volumes", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void transportFailurePropagates() {
        TransportExhaustedException failure = new TransportExhaustedException(
                HttpMethod.GET, "http://topology.local/api/v1/volumes", 3, new RuntimeException("down"));
        when(transport.get(anyString(), any())).thenThrow(failure);

        assertThatThrownBy(() -> fetcher.fetchLinked(TOPOLOGY, "volumes", null)).isSameAs(failure);
    }

    private String countedPage(int firstId, int count) {
        return countedPage(firstId, count, 25);
    }

    private String countedPage(int firstId, int count, int total) {
        StringBuilder results = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                results.append(',');
            }
            results.append("{\"id\": ").append(firstId + i).append('}');
        }
        return "{\"results\": [" + results + "], \"total\": " + total + ", \"per_page\": 10}";
    }

    private static ResponseEntity<String> json(String body) {
        return ResponseEntity.ok(body);
    }

    private static List<Object> ids(CollectionResult result) {
        return result.records().stream().map(DataRecord::id).toList();
    }
}
