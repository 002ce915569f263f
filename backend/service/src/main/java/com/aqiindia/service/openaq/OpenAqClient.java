package com.aqiindia.service.openaq;

import com.aqiindia.collectors.aqi.AirQualityProvider;
import com.aqiindia.collectors.aqi.ConcentrationValues;
import com.aqiindia.collectors.aqi.ProviderReading;
import com.aqiindia.core.aqi.Measurement;
import com.aqiindia.core.aqi.Pollutant;
import com.aqiindia.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

public final class OpenAqClient implements AirQualityProvider {
    public static final String DEFAULT_BASE_URL = "https://api.openaq.org";
    private static final Logger LOGGER = Logger.getLogger(OpenAqClient.class.getName());

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Clock clock;
    private final String baseUrl;

    public OpenAqClient(HttpClient httpClient, Duration timeout, Clock clock, String baseUrl) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.clock = clock;
        String normalized = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        this.baseUrl = normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    @Override
    public String source() {
        return "OPENAQ";
    }

    @Override
    public Optional<ProviderReading> latest(String city) {
        String normalized = city == null ? "" : city.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("City must not be blank");
        }

        URI uri = URI.create(baseUrl + "/v2/latest?country=IN&city=" + URLEncoder.encode(normalized, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("OpenAQ request failed with status " + response.statusCode() + " for " + normalized);
            }
            JsonNode root = JsonUtils.readTree(response.body(), "OpenAQ response for " + normalized);
            JsonNode results = root.path("results");
            if (!results.isArray() || results.isEmpty()) {
                LOGGER.fine(() -> "OpenAQ returned no results for " + normalized);
                return Optional.empty();
            }
            return toReading(normalized, results.get(0).path("measurements"));
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("OpenAQ request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("OpenAQ request failed", e);
        }
    }

    private Optional<ProviderReading> toReading(String city, JsonNode measurementNodes) {
        if (!measurementNodes.isArray()) {
            return Optional.empty();
        }
        Map<Pollutant, Measurement> byPollutant = new EnumMap<>(Pollutant.class);
        Instant newest = null;
        for (JsonNode node : measurementNodes) {
            Optional<Pollutant> pollutant = Pollutant.fromParameter(node.path("parameter").asText(null));
            if (pollutant.isEmpty() || byPollutant.containsKey(pollutant.get())) {
                continue;
            }
            OptionalDouble value = ConcentrationValues.fromJson(pollutant.get(), node.get("value"));
            if (value.isEmpty()) {
                continue;
            }
            Instant observedAt = parseTimestamp(node.path("lastUpdated").asText(""));
            byPollutant.put(pollutant.get(), new Measurement(pollutant.get(), value.getAsDouble(), observedAt));
            if (observedAt != null && (newest == null || observedAt.isAfter(newest))) {
                newest = observedAt;
            }
        }
        if (byPollutant.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ProviderReading(
                city,
                new ArrayList<>(byPollutant.values()),
                newest == null ? Instant.now(clock) : newest,
                source()
        ));
    }

    private static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            LOGGER.fine(() -> "Ignoring unparseable OpenAQ timestamp " + raw);
            return null;
        }
    }
}
