package com.aqiindia.core.model;

/**
 * One entry of {@code collectors.json}. {@code intervalSeconds} is null when the entry leaves the
 * schedule to the collector's default.
 */
public record CollectorConfig(
        String name,
        boolean enabled,
        Integer intervalSeconds
) {
}
