package com.aqiindia.service.api;

import com.aqiindia.collectors.api.Collector;
import com.aqiindia.core.aqi.InvalidConcentrationException;
import com.aqiindia.core.util.JsonUtils;
import com.aqiindia.service.aqi.AirQualityService;
import com.aqiindia.service.aqi.AqiView;
import com.aqiindia.service.aqi.ProviderUnavailableException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String CITY_PREFIX = "/api/city/";
    private static final int DEFAULT_TOP_CITIES = 10;

    private final int port;
    private final AirQualityService airQualityService;
    private final CollectorStatusTracker statusTracker;
    private final List<Collector> collectors;
    private final CorsPolicy corsPolicy;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, AirQualityService airQualityService, List<Collector> collectors) {
        this(port, airQualityService, CollectorStatusTracker.empty(), collectors, CorsPolicy.allowAny());
    }

    public ApiServer(
            int port,
            AirQualityService airQualityService,
            CollectorStatusTracker statusTracker,
            List<Collector> collectors,
            CorsPolicy corsPolicy
    ) {
        this.port = port;
        this.airQualityService = airQualityService;
        this.statusTracker = statusTracker;
        this.collectors = List.copyOf(collectors);
        this.corsPolicy = corsPolicy;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/", route(this::handleRoot));
            server.createContext("/api/health", route(this::handleHealth));
            server.createContext("/api/top-cities", route(this::handleTopCities));
            server.createContext("/api/city", route(this::handleCity));
            server.createContext("/api/aqi", route(this::handleAqi));
            server.createContext("/api/collectors", route(this::handleCollectors));
            server.createContext("/api/collectors/status", route(this::handleCollectorStatus));
            server.start();
            LOGGER.info(() -> "API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            writeError(exchange, 404, "not_found", "No route for " + exchange.getRequestURI().getPath());
            return;
        }
        writeJson(exchange, 200, Map.of("status", "OK", "message", "AQI backend running"));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleTopCities(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit").trim()) : DEFAULT_TOP_CITIES;
        } catch (RuntimeException invalidParamError) {
            writeError(exchange, 400, "invalid_query_params", "limit must be an integer");
            return;
        }
        writeJson(exchange, 200, airQualityService.topCities(limit));
    }

    private void handleCity(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        String rawPath = exchange.getRequestURI().getRawPath();
        String encodedCity = rawPath.startsWith(CITY_PREFIX) ? rawPath.substring(CITY_PREFIX.length()) : "";
        String city = URLDecoder.decode(encodedCity, StandardCharsets.UTF_8).trim();
        if (city.isEmpty() || city.contains("/")) {
            writeError(exchange, 404, "not_found", "City path must be /api/city/{city}");
            return;
        }
        boolean refresh = "true".equalsIgnoreCase(queryParams(exchange.getRequestURI()).get("refresh"));
        writeJson(exchange, 200, airQualityService.cityStatus(city, refresh));
    }

    private void handleAqi(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());
        writeJson(exchange, 200, AqiView.of(airQualityService.compute(query.get("pm25"), query.get("pm10"))));
    }

    private void handleCollectors(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        List<Map<String, Object>> dto = new ArrayList<>();
        for (Collector collector : collectors) {
            dto.add(Map.of(
                    "name", collector.name(),
                    "intervalSeconds", collector.interval().toSeconds()
            ));
        }
        writeJson(exchange, 200, dto);
    }

    private void handleCollectorStatus(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, statusTracker.statusSnapshot());
    }

    private HttpHandler route(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (InvalidConcentrationException e) {
                writeError(exchange, 400, "invalid_concentration", e.getMessage());
            } catch (IllegalArgumentException e) {
                writeError(exchange, 400, "invalid_query_params", e.getMessage());
            } catch (ProviderUnavailableException e) {
                LOGGER.log(Level.WARNING, "Provider unavailable for " + exchange.getRequestURI(), e);
                writeError(exchange, 502, "provider_unavailable", e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Request failed for " + exchange.getRequestURI(), e);
                writeError(exchange, 500, "internal_error", "An unexpected error occurred. Please try again later.");
            } finally {
                exchange.close();
            }
        };
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            corsPolicy.applyPreflight(exchange.getRequestHeaders(), exchange.getResponseHeaders());
            exchange.sendResponseHeaders(204, -1);
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET, OPTIONS");
            exchange.sendResponseHeaders(405, -1);
            return false;
        }
        return true;
    }

    private void writeError(HttpExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        if (message != null) {
            body.put("message", message);
        }
        writeJson(exchange, status, body);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        corsPolicy.applyTo(exchange.getRequestHeaders(), exchange.getResponseHeaders());
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
