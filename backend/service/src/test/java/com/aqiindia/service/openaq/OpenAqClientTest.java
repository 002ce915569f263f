package com.aqiindia.service.openaq;

import com.aqiindia.collectors.aqi.ProviderReading;
import com.aqiindia.core.aqi.InvalidConcentrationException;
import com.aqiindia.core.aqi.Measurement;
import com.aqiindia.core.aqi.Pollutant;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAqClientTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-10T00:00:00Z"), ZoneOffset.UTC);

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void readsFirstResultAndKeepsFirstValuePerPollutant() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        String base = serve(200, fixture("openaq-latest-delhi.json"), query, accept);

        ProviderReading reading = client(base).latest("Delhi").orElseThrow();

        Map<Pollutant, Double> values = reading.measurements().stream()
                .collect(Collectors.toMap(Measurement::pollutant, Measurement::concentration));
        assertEquals(Map.of(Pollutant.PM25, 45.0, Pollutant.PM10, 150.0), values);
        // 19:15+05:30 is 13:45Z, so the pm10 reading is the newest one used
        assertEquals(Instant.parse("2026-02-09T19:00:00Z"), reading.observedAt());
        assertEquals("OPENAQ", reading.source());
        assertEquals("country=IN&city=Delhi", query.get());
        assertEquals("application/json", accept.get());
    }

    @Test
    void encodesCityAndStripsTrailingSlashFromBaseUrl() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        String base = serve(200, "{\"results\":[]}", query, new AtomicReference<>());

        Optional<ProviderReading> reading = client(base + "/").latest(" New Delhi ");

        assertTrue(reading.isEmpty());
        assertEquals("country=IN&city=New+Delhi", query.get());
    }

    @Test
    void resultWithoutParticulatesIsNoData() throws Exception {
        String base = serve(200, """
                {"results":[{"measurements":[{"parameter":"o3","value":12.0}]}]}
                """, new AtomicReference<>(), new AtomicReference<>());

        assertTrue(client(base).latest("Delhi").isEmpty());
    }

    @Test
    void nullValueIsSkippedAndMissingTimestampFallsBackToClock() throws Exception {
        String base = serve(200, """
                {"results":[{"measurements":[
                  {"parameter":"pm25","value":null},
                  {"parameter":"pm10","value":"40","lastUpdated":"yesterday"}
                ]}]}
                """, new AtomicReference<>(), new AtomicReference<>());

        ProviderReading reading = client(base).latest("Mumbai").orElseThrow();

        assertEquals(1, reading.measurements().size());
        assertEquals(Pollutant.PM10, reading.measurements().get(0).pollutant());
        assertEquals(40.0, reading.measurements().get(0).concentration());
        assertEquals(CLOCK.instant(), reading.observedAt());
    }

    @Test
    void negativeOrNonNumericValueIsRejected() throws Exception {
        String negative = serve(200, """
                {"results":[{"measurements":[{"parameter":"pm25","value":-3.5}]}]}
                """, new AtomicReference<>(), new AtomicReference<>());
        InvalidConcentrationException error = assertThrows(
                InvalidConcentrationException.class,
                () -> client(negative).latest("Delhi")
        );
        assertEquals(Pollutant.PM25, error.pollutant());
        server.stop(0);

        String text = serve(200, """
                {"results":[{"measurements":[{"parameter":"pm10","value":"n/a"}]}]}
                """, new AtomicReference<>(), new AtomicReference<>());
        assertThrows(InvalidConcentrationException.class, () -> client(text).latest("Delhi"));
    }

    @Test
    void nonSuccessStatusFails() throws Exception {
        String base = serve(503, "{\"message\":\"down\"}", new AtomicReference<>(), new AtomicReference<>());

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> client(base).latest("Delhi"));
        assertEquals("OpenAQ request failed with status 503 for Delhi", error.getMessage());
    }

    @Test
    void malformedBodyFails() throws Exception {
        String base = serve(200, "<html>oops</html>", new AtomicReference<>(), new AtomicReference<>());

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> client(base).latest("Delhi"));
        assertTrue(error.getMessage().contains("Malformed JSON"));
    }

    @Test
    void blankCityIsRejectedBeforeAnyRequest() {
        OpenAqClient client = client("http://127.0.0.1:9");
        assertThrows(IllegalArgumentException.class, () -> client.latest("  "));
    }

    private OpenAqClient client(String baseUrl) {
        return new OpenAqClient(HttpClient.newHttpClient(), Duration.ofSeconds(2), CLOCK, baseUrl);
    }

    private String serve(int status, String body, AtomicReference<String> query, AtomicReference<String> accept) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v2/latest", exchange -> {
            query.set(exchange.getRequestURI().getRawQuery());
            accept.set(exchange.getRequestHeaders().getFirst("Accept"));
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = OpenAqClientTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
