package com.catalog.scraper.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * Resolves {@code href} against {@code baseUrl}. Returns null for blank, non-http or malformed input.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("#") || trimmed.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
            return null;
        }
        try {
            URI resolved = baseUrl == null || baseUrl.isBlank()
                ? new URI(trimmed)
                : new URI(baseUrl.trim()).resolve(trimmed);
            return isHttp(resolved) ? resolved.toString() : null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Normalized form used for in-run deduplication: lower-case scheme and host, no fragment,
     * dot segments removed.
     */
    public static String normalize(String url) {
        URI uri = toHttpUri(url);
        if (uri == null) {
            return url == null ? null : url.trim();
        }
        try {
            URI normalized = new URI(
                uri.getScheme().toLowerCase(Locale.ROOT),
                uri.getUserInfo(),
                uri.getHost().toLowerCase(Locale.ROOT),
                uri.getPort(),
                uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath(),
                uri.getQuery(),
                null
            ).normalize();
            return normalized.toString();
        } catch (URISyntaxException e) {
            return uri.toString();
        }
    }

    public static URI toHttpUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            return isHttp(uri) ? uri : null;
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isHttp(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }
}
