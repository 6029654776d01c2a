package fr.lapetina.gateway.integration;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.gateway.GatewayFactory;
import fr.lapetina.gateway.domain.exception.UpstreamException;
import fr.lapetina.gateway.domain.model.OutboundRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Test extension of GatewayFactory that provides stub HTTP client functionality.
 */
public final class TestGatewayFactory extends GatewayFactory {

    private final StubHttpClient stubHttpClient;

    private TestGatewayFactory(String configPath) {
        super(configPath, new StubHttpClient());
        this.stubHttpClient = (StubHttpClient) getHttpClient();
    }

    /**
     * Creates a started test factory from the default test configuration.
     */
    public static TestGatewayFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a started test factory from a custom configuration path.
     */
    public static TestGatewayFactory create(String configPath) {
        TestGatewayFactory factory = new TestGatewayFactory(configPath);
        factory.start();
        return factory;
    }

    /**
     * Sets the stub response generator for proxied requests.
     */
    public void setHttpResponse(BiFunction<ServiceInstance, OutboundRequest, ProxyResponse> responseGenerator) {
        stubHttpClient.setResponseGenerator(responseGenerator);
    }

    /**
     * Sets a fixed 200 response echoing the target path for all requests.
     */
    public void setSuccessResponse() {
        stubHttpClient.setResponseGenerator((instance, request) -> ProxyResponse.of(200, Map.of(),
                Map.of("path", request.path(), "requestId", request.requestId()), 1, instance.getId()));
    }

    /**
     * Makes every proxied request fail with a downstream HTTP 500.
     */
    public void setServerError() {
        stubHttpClient.setResponseGenerator((instance, request) -> {
            throw new UpstreamException(instance.getId(), 500, "boom");
        });
    }

    /**
     * Makes every proxied request wait forever, leaving timeouts to the gateway.
     */
    public void setHangingResponse() {
        stubHttpClient.hanging = true;
    }

    /**
     * The future handed out by the most recent hanging send, or null.
     */
    public CompletableFuture<ProxyResponse> getLastHangingCall() {
        return stubHttpClient.lastHanging;
    }

    /**
     * Makes health probes of the named services fail.
     */
    public void setUnhealthy(String... serviceNames) {
        stubHttpClient.unhealthy.addAll(Set.of(serviceNames));
    }

    public void setHealthy(String... serviceNames) {
        stubHttpClient.unhealthy.removeAll(Set.of(serviceNames));
    }

    /**
     * Number of proxied requests that reached the stub.
     */
    public int getSendCount() {
        return stubHttpClient.sendCount.get();
    }

    /**
     * Stub HTTP client for testing.
     */
    static class StubHttpClient extends GatewayHttpClient {
        private final Set<String> unhealthy = ConcurrentHashMap.newKeySet();
        private final AtomicInteger sendCount = new AtomicInteger();
        private volatile BiFunction<ServiceInstance, OutboundRequest, ProxyResponse> responseGenerator;
        private volatile boolean hanging;
        private volatile CompletableFuture<ProxyResponse> lastHanging;

        StubHttpClient() {
            super(Duration.ofSeconds(1));
        }

        void setResponseGenerator(BiFunction<ServiceInstance, OutboundRequest, ProxyResponse> generator) {
            this.responseGenerator = generator;
            this.hanging = false;
        }

        @Override
        public CompletableFuture<ProxyResponse> send(ServiceInstance instance, OutboundRequest request,
                                                     Duration timeout) {
            sendCount.incrementAndGet();
            if (hanging) {
                CompletableFuture<ProxyResponse> pending = new CompletableFuture<>();
                lastHanging = pending;
                return pending;
            }
            BiFunction<ServiceInstance, OutboundRequest, ProxyResponse> generator = responseGenerator;
            if (generator == null) {
                return CompletableFuture.completedFuture(
                        ProxyResponse.of(200, Map.of(), "Default test response", 1, instance.getId()));
            }
            try {
                return CompletableFuture.completedFuture(generator.apply(instance, request));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        @Override
        public CompletableFuture<HealthProbeResponse> probe(ServiceInstance instance, Duration timeout) {
            if (unhealthy.contains(instance.getName())) {
                return CompletableFuture.failedFuture(new UpstreamException(instance.getId(), 503, "unavailable"));
            }
            return CompletableFuture.completedFuture(new HealthProbeResponse(200,
                    JsonNodeFactory.instance.objectNode().put("status", "healthy"), 1));
        }
    }
}
