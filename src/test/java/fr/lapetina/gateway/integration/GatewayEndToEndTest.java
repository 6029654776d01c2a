package fr.lapetina.gateway.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.gateway.GatewayApplication;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.lifecycle.ServiceDefinition;
import fr.lapetina.gateway.lifecycle.ServiceManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the gateway over real HTTP against a local downstream service.
 */
class GatewayEndToEndTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer downstream;
    private GatewayApplication app;
    private HttpClient client;
    private final AtomicInteger failHits = new AtomicInteger();
    private final AtomicReference<String> lastRequestId = new AtomicReference<>();
    private final AtomicReference<String> lastCookie = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        downstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        downstream.createContext("/health", exchange -> respond(exchange, 200, "{\"status\":\"healthy\"}"));
        downstream.createContext("/users", exchange -> {
            lastRequestId.set(exchange.getRequestHeaders().getFirst("x-request-id"));
            lastCookie.set(exchange.getRequestHeaders().getFirst("cookie"));
            respond(exchange, 200, "{\"users\":[\"ada\",\"linus\"]}");
        });
        downstream.createContext("/fail", exchange -> {
            failHits.incrementAndGet();
            respond(exchange, 500, "{\"message\":\"database exploded\"}");
        });
        downstream.createContext("/missing", exchange -> respond(exchange, 404, "{\"message\":\"no such user\"}"));
        downstream.start();

        app = new GatewayApplication("test-config.yaml");
        app.start();

        ServiceManager serviceManager = app.getFactory().getServiceManager();
        serviceManager.registerService(ServiceDefinition.builder()
                .name("users")
                .host("127.0.0.1")
                .port(downstream.getAddress().getPort())
                .startupTimeout(Duration.ofSeconds(5))
                .addRoute(route("GET", "/api/users", "/users").build())
                .addRoute(route("GET", "/api/fail", "/fail").build())
                .addRoute(route("GET", "/api/missing", "/missing").build())
                .addRoute(route("GET", "/api/limited", "/users")
                        .rateLimit(RateLimitRule.of(60_000, 1, 0, 1_000))
                        .build())
                .build());
        serviceManager.startService("users").get(10, TimeUnit.SECONDS);

        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
        if (downstream != null) {
            downstream.stop(0);
        }
    }

    private static RouteConfig.Builder route(String method, String path, String targetPath) {
        return RouteConfig.builder().method(method).path(path).serviceName("users").targetPath(targetPath);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HttpResponse<String> get(String path, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + path))
                .timeout(Duration.ofSeconds(10))
                .GET();
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("should proxy requests and forward the request id but not cookies")
    void shouldProxyRequests() throws Exception {
        HttpResponse<String> response = get("/api/users", "x-request-id", "trace-42", "Cookie", "session=secret");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(response.body()).get("users")).hasSize(2);
        assertThat(lastRequestId.get()).isEqualTo("trace-42");
        assertThat(lastCookie.get()).isNull();
    }

    @Test
    @DisplayName("should forward downstream 4xx responses unchanged")
    void shouldForwardClientErrors() throws Exception {
        HttpResponse<String> response = get("/api/missing");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.body()).contains("no such user");
    }

    @Test
    @DisplayName("should open the circuit after five downstream 500s and answer 503 without calling downstream")
    void shouldOpenCircuit() throws Exception {
        for (int i = 0; i < 5; i++) {
            HttpResponse<String> response = get("/api/fail");
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.body()).doesNotContain("database exploded");
        }

        HttpResponse<String> rejected = get("/api/fail");

        assertThat(rejected.statusCode()).isEqualTo(503);
        JsonNode error = MAPPER.readTree(rejected.body()).get("error");
        assertThat(error.get("code").asText()).isEqualTo("CIRCUIT_OPEN");
        assertThat(error.get("requestId").asText()).isNotBlank();
        assertThat(failHits.get()).isEqualTo(5);

        HttpResponse<String> breakers = get("/admin/breakers");
        assertThat(MAPPER.readTree(breakers.body()).get("proxy-users").get("state").asText()).isEqualTo("OPEN");

        HttpResponse<String> reset = post("/admin/breakers/proxy-users/reset", "");
        assertThat(reset.statusCode()).isEqualTo(200);
        assertThat(get("/api/fail").statusCode()).isEqualTo(500);
    }

    @Test
    @DisplayName("should answer 404 for unknown paths")
    void shouldAnswer404() throws Exception {
        HttpResponse<String> response = get("/api/nothing-here");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(MAPPER.readTree(response.body()).get("error").get("code").asText()).isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("should answer 429 once the rate limit and its queue are exhausted")
    void shouldRateLimit() throws Exception {
        assertThat(get("/api/limited").statusCode()).isEqualTo(200);

        HttpResponse<String> limited = get("/api/limited");

        assertThat(limited.statusCode()).isEqualTo(429);
        assertThat(MAPPER.readTree(limited.body()).get("error").get("code").asText()).isEqualTo("RATE_LIMITED");
    }

    @Test
    @DisplayName("should expose health, metrics and lifecycle status")
    void shouldExposeOperationalEndpoints() throws Exception {
        get("/api/users");

        HttpResponse<String> health = get("/health");
        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(health.body()).get("status").asText()).isIn("healthy", "degraded");

        HttpResponse<String> metrics = get("/metrics");
        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("gateway_test_requests_total");

        HttpResponse<String> lifecycle = get("/admin/lifecycle");
        assertThat(lifecycle.statusCode()).isEqualTo(200);
        assertThat(lifecycle.body()).contains("users").contains("RUNNING");

        HttpResponse<String> services = get("/admin/services");
        assertThat(services.body()).contains("users");
    }

    @Test
    @DisplayName("should change the load balancing strategy at runtime")
    void shouldChangeStrategy() throws Exception {
        HttpResponse<String> changed = post("/admin/strategy", "{\"strategy\":\"least_connections\"}");
        assertThat(changed.statusCode()).isEqualTo(200);
        assertThat(app.getFactory().getLoadBalancer().getStrategy().getName()).isEqualTo("least-connections");

        HttpResponse<String> unknown = post("/admin/strategy", "{\"strategy\":\"fastest\"}");
        assertThat(unknown.statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("should add and remove routes through the admin API")
    void shouldManageRoutes() throws Exception {
        HttpResponse<String> added = post("/admin/routes",
                "{\"method\":\"GET\",\"path\":\"/api/people\",\"serviceName\":\"users\",\"targetPath\":\"/users\"}");
        assertThat(added.statusCode()).isEqualTo(201);
        assertThat(get("/api/people").statusCode()).isEqualTo(200);

        HttpRequest delete = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + "/admin/routes?method=GET&path=/api/people"))
                .DELETE()
                .build();
        assertThat(client.send(delete, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(200);
        assertThat(get("/api/people").statusCode()).isEqualTo(404);
    }
}
