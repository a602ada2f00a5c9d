package fr.lapetina.airouting.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.airouting.RoutingMonitor;
import fr.lapetina.airouting.api.dto.RequestCompletionReport;
import fr.lapetina.airouting.api.dto.RequestStartReport;
import fr.lapetina.airouting.api.dto.RouteRequest;
import fr.lapetina.airouting.domain.model.HealthState;
import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.Provider;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.strategy.StrategyFactory;
import fr.lapetina.airouting.infrastructure.config.RoutingConfig;
import fr.lapetina.airouting.routing.NoProvidersAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /route - Select a provider for a request
 * - POST /requests/start - Report that a provider request was sent
 * - POST /requests/{id}/complete - Report the outcome of a provider request
 * - GET /health - Provider health overview
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /dashboard - Full monitoring dashboard
 * - GET /summary - One-line status
 * - GET /stats/{id} - Statistics of a provider and/or service
 * - GET /history?subject=&amp;limit= - Recent operation history
 * - GET /export - Complete performance dump
 * - GET /recommendations - Operator recommendations
 * - POST /alerts/{id}/resolve - Resolve an alert
 * - GET|POST /admin/strategy - Read or change load balancing strategy
 * - POST /admin/monitoring - Enable or disable operation timing
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final int DEFAULT_HISTORY_LIMIT = 100;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RoutingMonitor monitor;

    public HttpServer(int port, int backlog, int threads, RoutingMonitor monitor) throws IOException {
        this.monitor = monitor;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/route", new RouteHandler());
        server.createContext("/requests", new RequestTrackingHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/dashboard", new QueryHandler());
        server.createContext("/summary", new QueryHandler());
        server.createContext("/stats", new QueryHandler());
        server.createContext("/history", new QueryHandler());
        server.createContext("/export", new QueryHandler());
        server.createContext("/recommendations", new QueryHandler());
        server.createContext("/alerts", new AlertHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on port {}", port);
    }

    public HttpServer(RoutingConfig.ServerConfig config, RoutingMonitor monitor) throws IOException {
        this(config.getPort(), config.getBacklog(), config.getThreads(), monitor);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== ROUTE HANDLER ====================

    private class RouteHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                RouteRequest request = readBody(exchange, RouteRequest.class);
                if (request.getRequestId() == null) {
                    request.setRequestId(exchange.getRequestHeaders().getFirst("X-Request-ID"));
                }

                RoutingDecision decision;
                try {
                    decision = monitor.selectProvider(request.toContext(), request.toRequirement());
                } catch (IllegalArgumentException e) {
                    sendError(exchange, 400, e.getMessage());
                    return;
                } catch (NoProvidersAvailableException e) {
                    log.warn("No provider available: reason={}", e.getReason());
                    sendError(exchange, 503, e.getMessage());
                    return;
                }

                MDC.put("requestId", decision.requestId());
                sendJson(exchange, 200, decision);

            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
            } catch (Exception e) {
                log.error("Error handling routing request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== REQUEST TRACKING HANDLER ====================

    private class RequestTrackingHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/requests/start") && "POST".equals(method)) {
                    handleStart(exchange);
                } else if (path.matches("/requests/[^/]+/complete") && "POST".equals(method)) {
                    handleComplete(exchange, pathSegment(path, 2));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
            } catch (Exception e) {
                log.error("Error handling request tracking", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void handleStart(HttpExchange exchange) throws IOException {
            RequestStartReport report = readBody(exchange, RequestStartReport.class);
            if (isBlank(report.getRequestId()) || isBlank(report.getProvider())) {
                sendError(exchange, 400, "Fields 'request_id' and 'provider' are required");
                return;
            }
            MDC.put("requestId", report.getRequestId());

            boolean started = monitor.trackRequestStart(
                    report.getRequestId(), report.getProvider(), report.getModel(), report.getService());
            if (!started) {
                sendError(exchange, 409, "Request already in flight: " + report.getRequestId());
                return;
            }
            sendJson(exchange, 202, Map.of(
                    "requestId", report.getRequestId(),
                    "inFlight", monitor.getRequestTracker().getInFlight(report.getProvider())
            ));
        }

        private void handleComplete(HttpExchange exchange, String requestId) throws IOException {
            MDC.put("requestId", requestId);
            RequestCompletionReport report = readBody(exchange, RequestCompletionReport.class);
            Double quality = report.getQuality();
            if (quality != null && (quality < 0.0 || quality > 1.0)) {
                sendError(exchange, 400, "Quality must be in [0, 1]");
                return;
            }

            Optional<HistoryRecord> record = monitor.trackRequestComplete(
                    requestId, report.isSuccess(), report.getErrorType(), quality);
            if (record.isEmpty()) {
                sendError(exchange, 404, "Unknown request: " + requestId);
                return;
            }
            sendJson(exchange, 200, record.get());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth());
            health.put("timestamp", System.currentTimeMillis());

            List<Map<String, Object>> providers = new ArrayList<>();
            for (Provider provider : monitor.getProviderRegistry().getAll()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", provider.getId());
                info.put("health", monitor.getHealthTracker().getState(provider.getId()).name());
                info.put("enabled", provider.isEnabled());
                info.put("inFlight", monitor.getRequestTracker().getInFlight(provider.getId()));
                info.put("weight", provider.getWeight());
                providers.add(info);
            }
            health.put("providers", providers);

            Map<String, Object> routing = new LinkedHashMap<>();
            routing.put("totalInFlight", monitor.getRequestTracker().getTotalInFlight());
            routing.put("journalRemaining", monitor.getDecisionJournal().getRemainingCapacity());
            routing.put("strategy", monitor.getStrategyName());
            health.put("routing", routing);

            int statusCode = "UP".equals(health.get("status")) ? 200 : 503;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth() {
            List<Provider> enabled = monitor.getProviderRegistry().getEnabled();
            if (enabled.isEmpty()) {
                return "DOWN";
            }

            long healthyCount = enabled.stream()
                    .filter(p -> monitor.getHealthTracker().getState(p.getId()) == HealthState.HEALTHY)
                    .count();

            if (healthyCount == 0) {
                return "DOWN";
            } else if (healthyCount < enabled.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = monitor.scrapeMetrics();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== QUERY HANDLER ====================

    private class QueryHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            URI uri = exchange.getRequestURI();
            String path = uri.getPath();

            try {
                if (path.equals("/dashboard")) {
                    sendJson(exchange, 200, monitor.getDashboard());
                } else if (path.equals("/summary")) {
                    sendJson(exchange, 200, monitor.getSummary());
                } else if (path.matches("/stats/[^/]+")) {
                    handleStats(exchange, pathSegment(path, 2));
                } else if (path.equals("/history")) {
                    handleHistory(exchange, queryParams(uri));
                } else if (path.equals("/export")) {
                    handleExport(exchange);
                } else if (path.equals("/recommendations")) {
                    sendJson(exchange, 200, monitor.getRecommendations());
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error handling query: path={}", path, e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            }
        }

        private void handleStats(HttpExchange exchange, String subjectId) throws IOException {
            Optional<StatsSnapshot> provider = monitor.getProviderStats(subjectId);
            Optional<StatsSnapshot> service = monitor.getServiceStats(subjectId);
            if (provider.isEmpty() && service.isEmpty()) {
                sendError(exchange, 404, "No statistics for: " + subjectId);
                return;
            }
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("id", subjectId);
            provider.ifPresent(s -> stats.put("provider", describe(s)));
            service.ifPresent(s -> stats.put("service", describe(s)));
            sendJson(exchange, 200, stats);
        }

        private Map<String, Object> describe(StatsSnapshot s) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("totalOperations", s.totalOperations());
            info.put("successfulOperations", s.successfulOperations());
            info.put("failedOperations", s.failedOperations());
            info.put("averageDurationMs", s.averageDurationMs());
            info.put("minDurationMs", s.minDurationMs());
            info.put("maxDurationMs", s.maxDurationMs());
            info.put("p95DurationMs", s.p95DurationMs());
            info.put("errorRate", s.errorRate());
            info.put("qualityScore", s.qualityScore());
            info.put("lastOperationAt", s.lastOperationAt());
            return info;
        }

        private void handleHistory(HttpExchange exchange, Map<String, String> params) throws IOException {
            int limit = DEFAULT_HISTORY_LIMIT;
            String rawLimit = params.get("limit");
            if (rawLimit != null) {
                try {
                    limit = Integer.parseInt(rawLimit);
                } catch (NumberFormatException e) {
                    sendError(exchange, 400, "Invalid limit: " + rawLimit);
                    return;
                }
                if (limit <= 0) {
                    sendError(exchange, 400, "Limit must be > 0");
                    return;
                }
            }
            sendJson(exchange, 200, monitor.getHistory(params.get("subject"), limit));
        }

        private void handleExport(HttpExchange exchange) throws IOException {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            monitor.writeSnapshot(buffer);
            byte[] bytes = buffer.toByteArray();
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ALERT HANDLER ====================

    private class AlertHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            try {
                if (path.matches("/alerts/[^/]+/resolve") && "POST".equals(exchange.getRequestMethod())) {
                    String alertId = pathSegment(path, 2);
                    if (!monitor.resolveAlert(alertId)) {
                        sendError(exchange, 404, "No unresolved alert: " + alertId);
                        return;
                    }
                    sendJson(exchange, 200, Map.of("alert", alertId, "resolved", true));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in alert handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else if (path.equals("/admin/monitoring") && "POST".equals(method)) {
                    handleMonitoring(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed request body: " + e.getOriginalMessage());
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        @SuppressWarnings("unchecked")
        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            Map<String, Object> request = readBody(exchange, Map.class);

            Object strategyName = request.get("strategy");
            if (!(strategyName instanceof String name) || name.isBlank()) {
                sendError(exchange, 400, "Missing 'strategy' field");
                return;
            }

            if (!monitor.setStrategy(name)) {
                sendError(exchange, 400, "Unknown strategy: " + name +
                        ". Available: " + StrategyFactory.getRegisteredNames());
                return;
            }

            sendJson(exchange, 200, Map.of(
                    "strategy", monitor.getStrategyName(),
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", monitor.getStrategyName(),
                    "available", StrategyFactory.getRegisteredNames()
            ));
        }

        @SuppressWarnings("unchecked")
        private void handleMonitoring(HttpExchange exchange) throws IOException {
            Map<String, Object> request = readBody(exchange, Map.class);
            if (!(request.get("enabled") instanceof Boolean enabled)) {
                sendError(exchange, 400, "Missing boolean 'enabled' field");
                return;
            }
            monitor.setMonitoringEnabled(enabled);
            sendJson(exchange, 200, Map.of("monitoringEnabled", monitor.isMonitoringEnabled()));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            RoutingConfig newConfig = monitor.reloadConfig();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "providers", newConfig.getProviders().size(),
                    "strategy", monitor.getStrategyName()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] body = is.readAllBytes();
            if (body.length == 0) {
                return objectMapper.readValue("{}", type);
            }
            return objectMapper.readValue(body, type);
        }
    }

    private static String pathSegment(String path, int index) {
        return URLDecoder.decode(path.split("/")[index], StandardCharsets.UTF_8);
    }

    private static Map<String, String> queryParams(URI uri) {
        Map<String, String> params = new HashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }
}
