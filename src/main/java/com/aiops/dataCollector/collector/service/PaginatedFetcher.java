package com.aiops.dataCollector.collector.service;

import com.aiops.dataCollector.collector.model.CollectionResult;
import com.aiops.dataCollector.collector.model.DataRecord;
import com.aiops.dataCollector.collector.model.ServiceLocation;
import com.aiops.dataCollector.transport.service.Transport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates a complete collection from a paginated backend.
 *
 * Two conventions are supported:
 * - count-based: {@code {results, total, per_page}}, pages requested with {@code ?page=n}
 * - link-based: {@code {data, links: {next}}}, following {@code next} until it is absent
 *
 * Pages are fetched sequentially and the returned result is fully materialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaginatedFetcher {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final Transport transport;
    private final ObjectMapper objectMapper;

    /**
     * Fetches every page of a count-based collection.
     *
     * @param url Collection URL, may already carry query parameters
     * @param headers Request headers, may be null
     * @return All records of pages 1 to pageCount, in page order
     */
    public CollectionResult fetchCounted(String url, Map<String, String> headers) {
        JsonNode first = body(transport.get(pageUrl(url, 1), headers), url);

        CollectionResult.Builder builder = CollectionResult.builder();
        appendRecords(builder, first.path("results"), url);

        int total = first.path("total").asInt(0);
        int perPage = first.has("per_page") ? first.path("per_page").asInt(0) : first.path("perPage").asInt(0);
        if (perPage <= 0) {
            log.debug("Count-based collection without page size, single page assumed - url: {}, total: {}", url, total);
            return builder.build();
        }

        // Upper bound is inclusive: page pageCount holds the remainder and must be fetched too.
        int pageCount = (int) Math.ceil((double) total / perPage);
        for (int page = 2; page <= pageCount; page++) {
            JsonNode next = body(transport.get(pageUrl(url, page), headers), url);
            appendRecords(builder, next.path("results"), url);
        }

        CollectionResult result = builder.build();
        log.debug("Count-based collection fetched - url: {}, total: {}, pages: {}, records: {}",
                url, total, Math.max(pageCount, 1), result.size());
        return result;
    }

    /**
     * Fetches every page of a link-based collection.
     *
     * @param location Backend serving the collection
     * @param collectionPath Path of the collection below the backend path
     * @param headers Request headers, may be null
     * @return Records of every page, concatenated in call order
     */
    public CollectionResult fetchLinked(ServiceLocation location, String collectionPath, Map<String, String> headers) {
        CollectionResult.Builder builder = CollectionResult.builder();
        String url = location.resolve(collectionPath);
        int pages = 0;

        while (url != null) {
            JsonNode page = body(transport.get(url, headers), url);
            pages++;

            // Some sub-collection endpoints answer with a bare array and no links
            if (page.isArray()) {
                appendRecords(builder, page, url);
                break;
            }

            appendRecords(builder, page.path("data"), url);
            JsonNode next = page.path("links").path("next");
            url = next.isTextual() && !next.asText().isBlank() ? location.resolveLink(next.asText()) : null;
        }

        CollectionResult result = builder.build();
        log.debug("Link-based collection fetched - collection: {}, pages: {}, records: {}",
                collectionPath, pages, result.size());
        return result;
    }

    private void appendRecords(CollectionResult.Builder builder, JsonNode items, String url) {
        if (items.isMissingNode() || items.isNull()) {
            return;
        }
        if (!items.isArray()) {
            throw new IllegalStateException("Expected a list of records from " + url + " but got " + items.getNodeType());
        }
        for (JsonNode item : items) {
            if (!item.isObject()) {
                throw new IllegalStateException("Expected record objects from " + url + " but got " + item.getNodeType());
            }
            builder.add(new DataRecord(objectMapper.convertValue(item, FIELDS)));
        }
    }

    private JsonNode body(ResponseEntity<String> response, String url) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Empty response body from " + url);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Response from " + url + " is not valid JSON", e);
        }
    }

    static String pageUrl(String url, int page) {
        return UriComponentsBuilder.fromUriString(url)
                .replaceQueryParam("page", page)
                .build()
                .toUriString();
    }
}
