package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.domain.exception.CircuitOpenException;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.OutboundRequest;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.balancer.LoadBalancer;
import fr.lapetina.gateway.infrastructure.http.CircuitBreaker;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerRegistry;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Proxies one admitted request: selects an instance, calls it through the
 * service's circuit breaker and shapes the response.
 *
 * The returned future always completes normally; failures become gateway
 * error responses. Breaker and load balancer state is updated before the
 * response is produced.
 */
public final class ProxyExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProxyExecutor.class);

    static final String BREAKER_PREFIX = "proxy-";

    private final LoadBalancer loadBalancer;
    private final CircuitBreakerRegistry breakers;
    private final GatewayHttpClient httpClient;
    private final OutboundRequestFactory requestFactory;

    public ProxyExecutor(
            LoadBalancer loadBalancer,
            CircuitBreakerRegistry breakers,
            GatewayHttpClient httpClient,
            OutboundRequestFactory requestFactory
    ) {
        this.loadBalancer = loadBalancer;
        this.breakers = breakers;
        this.httpClient = httpClient;
        this.requestFactory = requestFactory;
    }

    public CompletableFuture<ProxyResponse> execute(ProxyRequest request, RouteConfig route, String requestId) {
        long startNanos = System.nanoTime();
        String serviceName = route.getServiceName();

        Optional<ServiceInstance> selected = loadBalancer.select(serviceName, route.getTags());
        if (selected.isEmpty()) {
            log.warn("No instance available: requestId={}, service={}, tags={}",
                    requestId, serviceName, route.getTags());
            return CompletableFuture.completedFuture(GatewayErrors.toResponse(
                    ErrorType.NO_AVAILABLE_INSTANCE, "Service Unavailable", requestId, null, elapsedMs(startNanos)));
        }
        ServiceInstance instance = selected.get();

        OutboundRequest outbound;
        try {
            outbound = route.transformRequest(requestFactory.create(request, route, requestId));
        } catch (RuntimeException e) {
            log.error("Request transform failed: requestId={}, route={}", requestId, route.key(), e);
            return CompletableFuture.completedFuture(
                    GatewayErrors.toResponse(e, requestId, instance.getId(), elapsedMs(startNanos)));
        }

        CircuitBreaker breaker = breakers.get(BREAKER_PREFIX + serviceName);
        Duration timeout = route.getTimeout();

        log.debug("Proxying request: requestId={}, route={}, instanceId={}, timeoutMs={}",
                requestId, route.key(), instance.getId(), timeout.toMillis());

        loadBalancer.recordConnectionStart(instance.getId());
        CompletableFuture<ProxyResponse> call;
        try {
            call = breaker.execute(() -> sendAndTransform(route, instance, outbound, timeout), timeout);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((response, error) -> {
            long latencyMs = elapsedMs(startNanos);
            loadBalancer.recordConnectionEnd(instance.getId());
            if (error == null) {
                return onSuccess(route, requestId, instance, response, latencyMs);
            }
            return onFailure(route, requestId, instance, error, latencyMs);
        });
    }

    /**
     * Sends the request and applies the route's response transform, both
     * inside the breaker. Cancelling the returned future aborts the exchange.
     */
    private CompletableFuture<ProxyResponse> sendAndTransform(RouteConfig route, ServiceInstance instance,
                                                             OutboundRequest outbound, Duration timeout) {
        CompletableFuture<ProxyResponse> sent = httpClient.send(instance, outbound, timeout);
        CompletableFuture<ProxyResponse> transformed = sent.thenApply(route::transformResponse);
        transformed.whenComplete((response, error) -> {
            if (error instanceof CancellationException) {
                sent.cancel(true);
            }
        });
        return transformed;
    }

    private ProxyResponse onSuccess(RouteConfig route, String requestId, ServiceInstance instance,
                                    ProxyResponse response, long latencyMs) {
        loadBalancer.recordRequest(instance.getId(), latencyMs, response.statusCode() < 400);
        log.info("Request proxied: requestId={}, route={}, instanceId={}, status={}, latencyMs={}",
                requestId, route.key(), instance.getId(), response.statusCode(), latencyMs);
        return response;
    }

    private ProxyResponse onFailure(RouteConfig route, String requestId, ServiceInstance instance,
                                    Throwable error, long latencyMs) {
        Throwable cause = GatewayErrors.unwrap(error);
        // A rejected call never reached the instance
        if (!(cause instanceof CircuitOpenException)) {
            loadBalancer.recordRequest(instance.getId(), latencyMs, false);
        }
        ErrorType errorType = GatewayErrors.classify(cause);
        log.error("Request proxy failed: requestId={}, route={}, instanceId={}, errorType={}, error={}, latencyMs={}",
                requestId, route.key(), instance.getId(), errorType, cause.getMessage(), latencyMs);
        return GatewayErrors.toResponse(cause, requestId, instance.getId(), latencyMs);
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
