package com.aiops.dataCollector.transport.util;

/**
 * Utility class for service URLs given as configuration.
 */
public final class HttpUrls {

    private HttpUrls() {
    }

    /**
     * Prefixes {@code http://} when the value has no scheme (e.g. "next.local:8005").
     *
     * @param url URL or bare host[:port][/path]
     * @return Absolute URL
     */
    public static String withDefaultScheme(String url) {
        String trimmed = url.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "http://" + trimmed;
    }
}
