package com.aiops.dataCollector.collector.model;

/**
 * Base location of a backend: scheme and host, plus the API path prefix.
 */
public record ServiceLocation(String host, String path) {

    /**
     * Builds {@code host/path/relative}, skipping empty segments.
     */
    public String resolve(String relative) {
        StringBuilder url = new StringBuilder(trimTrailingSlash(host));
        appendSegment(url, path);
        appendSegment(url, relative);
        return url.toString();
    }

    /**
     * Builds the URL of a pagination link, which is relative to the host only.
     */
    public String resolveLink(String link) {
        String base = trimTrailingSlash(host);
        return link.startsWith("/") ? base + link : base + "/" + link;
    }

    private static void appendSegment(StringBuilder url, String segment) {
        if (segment == null || segment.isBlank()) {
            return;
        }
        String trimmed = segment;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        url.append('/').append(trimTrailingSlash(trimmed));
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
