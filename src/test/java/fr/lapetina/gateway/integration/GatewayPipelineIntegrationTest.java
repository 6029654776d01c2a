package fr.lapetina.gateway.integration;

import fr.lapetina.gateway.domain.event.RequestRecord;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.http.CircuitBreaker;
import fr.lapetina.gateway.routing.ApiGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the request pipeline with a stubbed downstream.
 */
class GatewayPipelineIntegrationTest {

    private TestGatewayFactory factory;
    private ApiGateway gateway;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create();
        gateway = factory.getGateway();
        // The stub probe answers healthy, so registration makes the instance selectable
        factory.getServiceRegistry().register(ServiceInstance.builder()
                .id("users-1").name("users").host("localhost").port(9001).build());
        gateway.registerRoute(RouteConfig.builder()
                .method("GET").path("/api/users").serviceName("users").targetPath("/users").build());
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private ProxyResponse call(String method, String path) throws Exception {
        return gateway.handle(ProxyRequest.of(method, path)).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should proxy a routed request to a healthy instance")
    void shouldProxyRoutedRequest() throws Exception {
        factory.setSuccessResponse();

        ProxyResponse response = call("GET", "/api/users");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.instanceId()).isEqualTo("users-1");
        assertThat(response.body()).isInstanceOf(Map.class);
        assertThat(((Map<?, ?>) response.body()).get("path")).isEqualTo("/users");
    }

    @Test
    @DisplayName("should leave unmatched requests unrouted")
    void shouldLeaveUnmatchedRequestsUnrouted() throws Exception {
        ProxyResponse response = call("GET", "/api/unknown");

        assertThat(response.routed()).isFalse();
        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(factory.getSendCount()).isZero();
    }

    @Test
    @DisplayName("should answer 503 when the service has no healthy instance")
    void shouldAnswer503WithoutInstances() throws Exception {
        gateway.registerRoute(RouteConfig.builder().method("GET").path("/api/orders").serviceName("orders").build());

        ProxyResponse response = call("GET", "/api/orders");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.errorType()).isEqualTo(ErrorType.NO_AVAILABLE_INSTANCE);
    }

    @Test
    @DisplayName("should open the circuit after repeated downstream errors and stop calling downstream")
    void shouldOpenCircuitAfterRepeatedErrors() throws Exception {
        factory.setServerError();

        for (int i = 0; i < 5; i++) {
            ProxyResponse response = call("GET", "/api/users");
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.errorType()).isEqualTo(ErrorType.UPSTREAM_ERROR);
        }
        int sentBefore = factory.getSendCount();

        ProxyResponse rejected = call("GET", "/api/users");

        assertThat(rejected.statusCode()).isEqualTo(503);
        assertThat(rejected.errorType()).isEqualTo(ErrorType.CIRCUIT_OPEN);
        assertThat(factory.getSendCount()).isEqualTo(sentBefore);
        assertThat(factory.getBreakers().find("proxy-users").map(CircuitBreaker::getState))
                .contains(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should forward 4xx responses without tripping the circuit")
    void shouldForwardClientErrors() throws Exception {
        factory.setHttpResponse((instance, request) ->
                ProxyResponse.of(404, Map.of(), "missing", 1, instance.getId()));

        for (int i = 0; i < 10; i++) {
            assertThat(call("GET", "/api/users").statusCode()).isEqualTo(404);
        }

        assertThat(factory.getBreakers().find("proxy-users").map(CircuitBreaker::getState))
                .contains(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should answer 504 when the downstream call exceeds the route timeout")
    void shouldTimeOutSlowCalls() throws Exception {
        gateway.registerRoute(RouteConfig.builder()
                .method("GET").path("/api/slow").serviceName("users").timeout(Duration.ofMillis(100)).build());
        factory.setHangingResponse();

        ProxyResponse response = call("GET", "/api/slow");

        assertThat(response.statusCode()).isEqualTo(504);
        assertThat(response.errorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(factory.getLoadBalancer().getActiveConnections("users-1")).isZero();
        assertThat(factory.getLastHangingCall()).isCancelled();
    }

    @Test
    @DisplayName("should count a failing response transform as a circuit failure")
    void shouldCountResponseTransformFailures() throws Exception {
        factory.setSuccessResponse();
        gateway.registerRoute(RouteConfig.builder()
                .method("GET").path("/api/broken").serviceName("users").targetPath("/users")
                .responseTransform(response -> {
                    throw new IllegalStateException("cannot reshape body");
                })
                .build());

        for (int i = 0; i < 5; i++) {
            ProxyResponse response = call("GET", "/api/broken");
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.errorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        }

        assertThat(factory.getBreakers().find("proxy-users").map(CircuitBreaker::getState))
                .contains(CircuitBreaker.State.OPEN);
        assertThat(factory.getLoadBalancer().getMetrics("users-1").orElseThrow().getErrorRate()).isPositive();
    }

    @Test
    @DisplayName("should rate limit per client and answer 429 once the queue is full")
    void shouldRateLimit() throws Exception {
        factory.setSuccessResponse();
        gateway.registerRoute(RouteConfig.builder()
                .method("POST").path("/api/login").serviceName("users")
                .rateLimit(RateLimitRule.of(60_000, 2, 0, 1_000))
                .build());
        ProxyRequest login = new ProxyRequest("POST", "/api/login", Map.of(), Map.of(), null, "10.0.0.7");
        ProxyRequest otherClient = new ProxyRequest("POST", "/api/login", Map.of(), Map.of(), null, "10.0.0.8");

        List<Integer> statuses = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            statuses.add(gateway.handle(login).get(5, TimeUnit.SECONDS).statusCode());
        }

        assertThat(statuses).containsExactly(200, 200, 429);
        assertThat(gateway.handle(otherClient).get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("should select instances by route tags")
    void shouldSelectByTags() throws Exception {
        factory.setSuccessResponse();
        factory.getServiceRegistry().register(ServiceInstance.builder()
                .id("users-eu").name("users").host("localhost").port(9002).tags(Set.of("eu")).build());
        gateway.registerRoute(RouteConfig.builder()
                .method("GET").path("/api/eu/users").serviceName("users").tags(Set.of("eu")).build());

        for (int i = 0; i < 4; i++) {
            assertThat(call("GET", "/api/eu/users").instanceId()).isEqualTo("users-eu");
        }
    }

    @Test
    @DisplayName("should publish a record for every routed request")
    void shouldPublishRequestRecords() throws Exception {
        factory.setSuccessResponse();
        List<RequestRecord> records = new CopyOnWriteArrayList<>();
        gateway.addListener(records::add);

        call("GET", "/api/users");
        call("GET", "/api/unknown");

        assertThat(records).hasSize(1);
        assertThat(records.get(0).serviceName()).isEqualTo("users");
        assertThat(records.get(0).statusCode()).isEqualTo(200);
        assertThat(factory.getMetricsRegistry().scrape()).contains("gateway_test");
    }
}
