package com.aiops.dataCollector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the collector.
 * Values are bound once at startup from application.yaml and can be overridden
 * through the environment (e.g. NEXT_SERVICE_URL, ALL_TENANTS).
 */
@Data
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    /**
     * Active worker for this deployment: "topological-inventory" or "host-inventory".
     * Blank means no worker is set and jobs are refused.
     */
    private String worker;

    /**
     * Downstream service receiving the collected payloads.
     */
    private String nextServiceUrl;

    /**
     * Collect every tenant known to the internal backend instead of the requesting one.
     */
    private boolean allTenants = false;

    /**
     * Ordered catalog entries collected by the topological worker.
     */
    private List<String> activeEntities = new ArrayList<>();

    /**
     * Named entity descriptors. Insertion order is kept.
     */
    private Map<String, Entity> entities = new LinkedHashMap<>();

    private Services services = new Services();
    private Http http = new Http();
    private Cache cache = new Cache();
    private Dispatch dispatch = new Dispatch();
    private HostInventory hostInventory = new HostInventory();

    @Data
    public static class Entity {
        private String mainCollection;
        private String subCollection;
        private String foreignKey;
        private String service;
    }

    @Data
    public static class Location {
        private String host = "";
        private String path = "";
    }

    @Data
    public static class Services {
        private Location sources = new Location();
        private Location topological = new Location();
        private Location topologicalInternal = new Location();
    }

    @Data
    public static class Http {
        /**
         * Attempts per call, including the first one. Must be greater than 1.
         */
        private int maxRetries = 3;
        private boolean sslVerify = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Cache {
        /**
         * "redis" (shared, default) or "local" (in-process Caffeine).
         */
        private String type = "redis";
        private Duration processWindow = Duration.ofSeconds(3600);
    }

    @Data
    public static class Dispatch {
        private int poolSize = 8;
        private int queueCapacity = 100;
    }

    @Data
    public static class HostInventory {
        private String url;
    }
}
