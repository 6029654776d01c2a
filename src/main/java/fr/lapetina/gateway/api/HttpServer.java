package fr.lapetina.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.gateway.api.dto.ErrorResponse;
import fr.lapetina.gateway.api.dto.InstanceView;
import fr.lapetina.gateway.api.dto.RouteView;
import fr.lapetina.gateway.domain.exception.ConfigurationException;
import fr.lapetina.gateway.domain.model.HealthStatus;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.gateway.domain.strategy.StrategyFactory;
import fr.lapetina.gateway.infrastructure.balancer.LoadBalancer;
import fr.lapetina.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.gateway.infrastructure.discovery.HealthChecker;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerRegistry;
import fr.lapetina.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.gateway.lifecycle.ServiceManager;
import fr.lapetina.gateway.lifecycle.ServiceStatus;
import fr.lapetina.gateway.routing.ApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inbound HTTP server using the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - /* - Proxied through the API gateway; unmatched routes get 404
 * - GET /health - System health
 * - GET /metrics - Prometheus metrics
 * - GET /admin/services - Registered instances per service
 * - GET /admin/services/{name}/health - Healthy/unhealthy counts for a service
 * - GET /admin/services/{name}/dependencies - Dependency availability for a service
 * - GET /admin/breakers - Circuit breaker stats
 * - POST /admin/breakers/reset - Reset all breakers
 * - POST /admin/breakers/{name}/reset - Reset one breaker
 * - GET /admin/load-balancer - Load balancer stats
 * - GET|POST /admin/strategy - Read or change the load balancing strategy
 * - GET /admin/rate-limits - Rate limiter stats
 * - GET /admin/rate-limits/{key} - Status of one rate limit key
 * - GET|POST|DELETE /admin/routes - List, add or remove gateway routes
 * - GET /admin/lifecycle - Managed service statuses
 * - POST /admin/lifecycle/{name}/start - Start a managed service
 * - POST /admin/lifecycle/{name}/stop - Stop a managed service
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final long RESPONSE_WAIT_SECONDS = 120;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ApiGateway gateway;
    private final ServiceRegistry registry;
    private final HealthChecker healthChecker;
    private final CircuitBreakerRegistry breakers;
    private final LoadBalancer loadBalancer;
    private final RateLimiter rateLimiter;
    private final ServiceManager serviceManager;
    private final MetricsRegistry metricsRegistry;
    private final Duration defaultRouteTimeout;

    public HttpServer(
            GatewayConfig.ServerConfig serverConfig,
            Duration defaultRouteTimeout,
            ApiGateway gateway,
            ServiceRegistry registry,
            HealthChecker healthChecker,
            CircuitBreakerRegistry breakers,
            LoadBalancer loadBalancer,
            RateLimiter rateLimiter,
            ServiceManager serviceManager,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.defaultRouteTimeout = defaultRouteTimeout;
        this.gateway = gateway;
        this.registry = registry;
        this.healthChecker = healthChecker;
        this.breakers = breakers;
        this.loadBalancer = loadBalancer;
        this.rateLimiter = rateLimiter;
        this.serviceManager = serviceManager;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/", new GatewayHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: host={}, port={}, workerThreads={}",
                serverConfig.getHost(), serverConfig.getPort(), serverConfig.getWorkerThreads());
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
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

    // ==================== GATEWAY HANDLER ====================

    private class GatewayHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String inboundId = exchange.getRequestHeaders().getFirst("x-request-id");
            String requestId = inboundId != null && !inboundId.isBlank() ? inboundId : gateway.nextRequestId();
            MDC.put("requestId", requestId);

            try {
                ProxyRequest request = toProxyRequest(exchange);
                CompletableFuture<ProxyResponse> future = gateway.handle(request, requestId);

                ProxyResponse response;
                try {
                    response = future.get(RESPONSE_WAIT_SECONDS, TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    log.warn("Gateway response wait timed out: method={}, path={}", request.method(), request.path());
                    future.cancel(true);
                    sendError(exchange, 504, "Gateway Timeout", requestId);
                    return;
                }

                if (!response.routed()) {
                    log.debug("No route matched: method={}, path={}", request.method(), request.path());
                    sendError(exchange, 404, "Not Found", requestId);
                    return;
                }
                sendProxyResponse(exchange, response);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Service Unavailable", requestId);
            } catch (ExecutionException | RuntimeException e) {
                log.error("Error handling gateway request", e);
                sendError(exchange, 500, "Internal Server Error", requestId);
            } finally {
                MDC.clear();
            }
        }
    }

    private ProxyRequest toProxyRequest(HttpExchange exchange) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        exchange.getRequestHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", values));
            }
        });

        Object body;
        try (InputStream is = exchange.getRequestBody()) {
            body = parseBody(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }

        InetSocketAddress remote = exchange.getRemoteAddress();
        String clientAddress = remote != null && remote.getAddress() != null
                ? remote.getAddress().getHostAddress()
                : null;

        return new ProxyRequest(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                headers,
                parseQuery(exchange.getRequestURI().getRawQuery()),
                body,
                clientAddress
        );
    }

    private Object parseBody(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    /**
     * Decodes a raw query string. Repeated names keep all their values in order.
     */
    static Map<String, List<String>> parseQuery(String rawQuery) {
        Map<String, List<String>> query = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            query.computeIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8), k -> new ArrayList<>())
                    .add(URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return query;
    }

    private void sendProxyResponse(HttpExchange exchange, ProxyResponse response) throws IOException {
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().set(name, value));

        Object body = response.body();
        if (body == null) {
            exchange.sendResponseHeaders(response.statusCode(), -1);
            exchange.close();
            return;
        }

        byte[] bytes;
        if (body instanceof String text) {
            bytes = text.getBytes(StandardCharsets.UTF_8);
            if (!exchange.getResponseHeaders().containsKey("content-type")) {
                exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            }
        } else {
            bytes = objectMapper.writeValueAsBytes(body);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
        }
        exchange.sendResponseHeaders(response.statusCode(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", null);
                return;
            }

            HealthChecker.SystemHealth systemHealth = healthChecker.getSystemHealth();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", systemHealth.overall().wireName());
            health.put("timestamp", systemHealth.timestamp());
            health.put("registry", registry.getStats());
            health.put("gateway", Map.of(
                    "running", gateway.isRunning(),
                    "routes", gateway.getRoutes().size()
            ));
            health.put("lifecycle", serviceManager.getStats());
            health.put("instances", systemHealth.results());

            int statusCode = systemHealth.overall() == HealthStatus.UNHEALTHY ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", null);
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {

        private static final String RATE_LIMITS_PREFIX = "/admin/rate-limits/";

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);

            try {
                if (path.equals("/admin/services") && "GET".equals(method)) {
                    handleListServices(exchange);
                } else if (path.matches("/admin/services/[^/]+/health") && "GET".equals(method)) {
                    sendJson(exchange, 200, registry.getServiceHealth(segment(path, 3)));
                } else if (path.matches("/admin/services/[^/]+/dependencies") && "GET".equals(method)) {
                    handleDependencies(exchange, segment(path, 3));
                } else if (path.equals("/admin/breakers") && "GET".equals(method)) {
                    sendJson(exchange, 200, breakers.getAllStats());
                } else if (path.equals("/admin/breakers/reset") && "POST".equals(method)) {
                    breakers.resetAll();
                    sendJson(exchange, 200, Map.of("message", "All circuit breakers reset"));
                } else if (path.matches("/admin/breakers/[^/]+/reset") && "POST".equals(method)) {
                    handleResetBreaker(exchange, segment(path, 3));
                } else if (path.equals("/admin/load-balancer") && "GET".equals(method)) {
                    sendJson(exchange, 200, loadBalancer.getStats());
                } else if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/rate-limits") && "GET".equals(method)) {
                    sendJson(exchange, 200, rateLimiter.getStats());
                } else if (path.startsWith(RATE_LIMITS_PREFIX) && "GET".equals(method)) {
                    handleRateLimitStatus(exchange, path.substring(RATE_LIMITS_PREFIX.length()));
                } else if (path.equals("/admin/routes") && "GET".equals(method)) {
                    sendJson(exchange, 200, gateway.getRoutes().stream().map(RouteView::fromRoute).toList());
                } else if (path.equals("/admin/routes") && "POST".equals(method)) {
                    handleAddRoute(exchange);
                } else if (path.equals("/admin/routes") && "DELETE".equals(method)) {
                    handleRemoveRoute(exchange);
                } else if (path.equals("/admin/lifecycle") && "GET".equals(method)) {
                    handleLifecycle(exchange);
                } else if (path.matches("/admin/lifecycle/[^/]+/start") && "POST".equals(method)) {
                    handleLifecycleAction(exchange, segment(path, 3), true);
                } else if (path.matches("/admin/lifecycle/[^/]+/stop") && "POST".equals(method)) {
                    handleLifecycleAction(exchange, segment(path, 3), false);
                } else {
                    sendError(exchange, 404, "Not Found", null);
                }
            } catch (JsonProcessingException e) {
                log.warn("Malformed admin request body: method={}, path={}, error={}",
                        method, path, e.getOriginalMessage());
                sendError(exchange, 400, "Malformed JSON body", null);
            } catch (Exception e) {
                log.error("Error in admin handler: method={}, path={}", method, path, e);
                sendError(exchange, 500, e.getMessage(), null);
            }
        }

        private String segment(String path, int index) {
            return path.split("/")[index];
        }

        private void handleListServices(HttpExchange exchange) throws IOException {
            Map<String, List<InstanceView>> services = new LinkedHashMap<>();
            for (Map.Entry<String, List<ServiceInstance>> entry : registry.getAllServices().entrySet()) {
                services.put(entry.getKey(), entry.getValue().stream().map(InstanceView::fromInstance).toList());
            }
            sendJson(exchange, 200, services);
        }

        private void handleDependencies(HttpExchange exchange, String name) throws IOException {
            if (registry.getInstances(name).isEmpty()) {
                sendError(exchange, 404, "Service not found: " + name, null);
                return;
            }
            sendJson(exchange, 200, Map.of(
                    "service", name,
                    "dependencies", registry.checkDependencies(name)
            ));
        }

        private void handleResetBreaker(HttpExchange exchange, String name) throws IOException {
            if (!breakers.reset(name)) {
                sendError(exchange, 404, "Circuit breaker not found: " + name, null);
                return;
            }
            sendJson(exchange, 200, Map.of("breaker", name, "message", "Circuit breaker reset"));
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            Map<String, String> request = readBody(exchange, Map.class);

            String strategyName = request != null ? request.get("strategy") : null;
            if (strategyName == null || strategyName.isBlank()) {
                sendError(exchange, 400, "Missing 'strategy' field", null);
                return;
            }

            Optional<LoadBalancingStrategy> strategy = StrategyFactory.create(strategyName);
            if (strategy.isEmpty()) {
                sendError(exchange, 400, "Unknown strategy: " + strategyName +
                        ". Available: " + StrategyFactory.getRegisteredNames(), null);
                return;
            }

            loadBalancer.setStrategy(strategy.get());
            sendJson(exchange, 200, Map.of(
                    "strategy", strategy.get().getName(),
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", loadBalancer.getStrategy().getName(),
                    "available", StrategyFactory.getRegisteredNames()
            ));
        }

        private void handleRateLimitStatus(HttpExchange exchange, String encodedKey) throws IOException {
            String key = URLDecoder.decode(encodedKey, StandardCharsets.UTF_8);
            Optional<RateLimiter.RateLimitStatus> status = rateLimiter.getStatus(key);
            if (status.isEmpty()) {
                sendError(exchange, 404, "No rate limit entry for key: " + key, null);
                return;
            }
            sendJson(exchange, 200, status.get());
        }

        private void handleAddRoute(HttpExchange exchange) throws IOException {
            GatewayConfig.RouteEntry entry = readBody(exchange, GatewayConfig.RouteEntry.class);
            if (entry == null || entry.getPath() == null || entry.getServiceName() == null) {
                sendError(exchange, 400, "Route requires 'path' and 'serviceName'", null);
                return;
            }

            RouteConfig route;
            try {
                route = entry.toRouteConfig(null, defaultRouteTimeout);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, "Invalid route: " + e.getMessage(), null);
                return;
            }
            gateway.registerRoute(route);
            sendJson(exchange, 201, RouteView.fromRoute(route));
        }

        private void handleRemoveRoute(HttpExchange exchange) throws IOException {
            Map<String, List<String>> query = parseQuery(exchange.getRequestURI().getRawQuery());
            String method = query.getOrDefault("method", List.of("GET")).get(0);
            String path = query.containsKey("path") ? query.get("path").get(0) : null;
            if (path == null) {
                sendError(exchange, 400, "Missing 'path' query parameter", null);
                return;
            }
            if (!gateway.removeRoute(method, path)) {
                sendError(exchange, 404, "Route not found: " + RouteConfig.key(method, path), null);
                return;
            }
            sendJson(exchange, 200, Map.of("route", RouteConfig.key(method, path), "message", "Route removed"));
        }

        private void handleLifecycle(HttpExchange exchange) throws IOException {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("stats", serviceManager.getStats());
            body.put("services", serviceManager.getAllServiceStatuses());
            try {
                body.put("startupOrder", serviceManager.calculateStartupOrder());
            } catch (ConfigurationException e) {
                body.put("startupOrderError", e.getMessage());
            }
            sendJson(exchange, 200, body);
        }

        private void handleLifecycleAction(HttpExchange exchange, String name, boolean start) throws IOException {
            CompletableFuture<ServiceStatus> action;
            try {
                action = start ? serviceManager.startService(name) : serviceManager.stopService(name);
            } catch (ConfigurationException e) {
                sendError(exchange, 404, e.getMessage(), null);
                return;
            }
            action.whenComplete((status, error) -> {
                if (error != null) {
                    log.warn("Lifecycle action failed: service={}, action={}, error={}",
                            name, start ? "start" : "stop", error.getMessage());
                }
            });

            sendJson(exchange, 202, Map.of(
                    "service", name,
                    "action", start ? "start" : "stop",
                    "status", serviceManager.getServiceStatus(name).orElseThrow()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return objectMapper.readValue(bytes, type);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message, String requestId)
            throws IOException {
        sendJson(exchange, statusCode, ErrorResponse.of(statusCode, message, requestId));
    }
}
