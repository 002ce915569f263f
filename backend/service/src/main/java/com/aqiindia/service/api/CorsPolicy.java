package com.aqiindia.service.api;

import com.sun.net.httpserver.Headers;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Origin allow-list for browser callers. A {@code *} entry allows any origin without credentials.
 */
public final class CorsPolicy {
    public static final List<String> DEFAULT_ORIGINS = List.of("https://aqiindia.live", "https://www.aqiindia.live");

    private final Set<String> allowedOrigins;
    private final boolean allowAny;

    public CorsPolicy(List<String> allowedOrigins) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String origin : allowedOrigins) {
            if (origin != null && !origin.isBlank()) {
                normalized.add(stripTrailingSlash(origin.trim()));
            }
        }
        this.allowAny = normalized.remove("*");
        this.allowedOrigins = Set.copyOf(normalized);
    }

    public static CorsPolicy allowAny() {
        return new CorsPolicy(List.of("*"));
    }

    public boolean isAllowed(String origin) {
        if (origin == null || origin.isBlank()) {
            return false;
        }
        return allowAny || allowedOrigins.contains(stripTrailingSlash(origin.trim()));
    }

    public void applyTo(Headers requestHeaders, Headers responseHeaders) {
        String origin = requestHeaders.getFirst("Origin");
        if (allowedOrigins.contains(origin == null ? "" : stripTrailingSlash(origin.trim()))) {
            responseHeaders.set("Access-Control-Allow-Origin", origin.trim());
            responseHeaders.set("Access-Control-Allow-Credentials", "true");
            responseHeaders.add("Vary", "Origin");
        } else if (allowAny) {
            responseHeaders.set("Access-Control-Allow-Origin", "*");
        }
    }

    public void applyPreflight(Headers requestHeaders, Headers responseHeaders) {
        applyTo(requestHeaders, responseHeaders);
        responseHeaders.set("Access-Control-Allow-Methods", "GET,OPTIONS");
        String requested = requestHeaders.getFirst("Access-Control-Request-Headers");
        responseHeaders.set("Access-Control-Allow-Headers",
                requested == null || requested.isBlank() ? "Content-Type, Authorization" : requested);
        responseHeaders.set("Access-Control-Max-Age", "600");
    }

    private static String stripTrailingSlash(String origin) {
        return origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
    }
}
