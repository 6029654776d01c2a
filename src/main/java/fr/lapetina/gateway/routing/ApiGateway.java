package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.disruptor.GatewayPipeline;
import fr.lapetina.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.gateway.domain.event.RequestRecord;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.infrastructure.balancer.LoadBalancer;
import fr.lapetina.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerRegistry;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerStats;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;
import fr.lapetina.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gateway.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Entry point for proxied traffic.
 *
 * Holds the route table and runs every inbound request through the request
 * pipeline: route lookup, rate limit, instance selection, breaker-protected
 * proxy call, response transform and metrics. Requests matching no route are
 * answered with {@link ProxyResponse#notRouted()} and left to the caller.
 */
public final class ApiGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApiGateway.class);

    private final RouteTable routeTable = new RouteTable();
    private final OutboundRequestFactory requestFactory;
    private final LoadBalancer loadBalancer;
    private final CircuitBreakerRegistry breakers;
    private final MetricsRegistry metrics;
    private final GatewayPipeline pipeline;
    private final List<Consumer<RequestRecord>> listeners = new CopyOnWriteArrayList<>();

    public ApiGateway(
            LoadBalancer loadBalancer,
            CircuitBreakerRegistry breakers,
            RateLimiter rateLimiter,
            GatewayHttpClient httpClient,
            MetricsRegistry metrics,
            GatewayConfig.DisruptorConfig disruptorConfig
    ) {
        this.requestFactory = new OutboundRequestFactory();
        this.loadBalancer = loadBalancer;
        this.breakers = breakers;
        this.metrics = metrics;
        this.pipeline = GatewayPipeline.builder()
                .ringBufferSize(disruptorConfig.getRingBufferSize())
                .waitStrategy(disruptorConfig.getWaitStrategy())
                .routeTable(routeTable)
                .rateLimiter(rateLimiter)
                .proxyExecutor(new ProxyExecutor(loadBalancer, breakers, httpClient, requestFactory))
                .recordSink(this::onRequestRecord)
                .build();
    }

    public void start() {
        pipeline.start();
        metrics.setRingBufferRemaining((int) pipeline.getRemainingCapacity());
        log.info("API gateway started: routes={}", routeTable.size());
    }

    public void registerRoute(RouteConfig route) {
        routeTable.register(route);
    }

    public boolean removeRoute(String method, String path) {
        return routeTable.remove(method, path).isPresent();
    }

    public void clearRoutes() {
        routeTable.clear();
    }

    public List<RouteConfig> getRoutes() {
        return routeTable.getAll();
    }

    public Optional<RouteConfig> findRoute(String method, String path) {
        return routeTable.find(method, path);
    }

    /**
     * Handles an inbound request.
     *
     * @return future that always completes normally with the response to send
     */
    public CompletableFuture<ProxyResponse> handle(ProxyRequest request) {
        return handle(request, requestFactory.nextRequestId());
    }

    /**
     * Handles an inbound request under a caller-chosen request id.
     */
    public CompletableFuture<ProxyResponse> handle(ProxyRequest request, String requestId) {
        try {
            CompletableFuture<ProxyResponse> response = pipeline.submit(request, requestId);
            metrics.setRingBufferRemaining((int) pipeline.getRemainingCapacity());
            return response;
        } catch (BackpressureException e) {
            log.warn("Request rejected: requestId={}, method={}, path={}, reason={}",
                    requestId, request.method(), request.path(), e.getReason());
            metrics.incrementErrorCount(ErrorType.BACKPRESSURE);
            return CompletableFuture.completedFuture(GatewayErrors.toResponse(e, requestId, null, 0));
        }
    }

    public String nextRequestId() {
        return requestFactory.nextRequestId();
    }

    private void onRequestRecord(RequestRecord record) {
        metrics.recordRequest(record.serviceName(), record.statusCode(), Duration.ofMillis(record.responseTimeMs()));
        if (record.errorType() != null) {
            metrics.incrementErrorCount(record.errorType());
        }
        for (Consumer<RequestRecord> listener : listeners) {
            try {
                listener.accept(record);
            } catch (Exception e) {
                log.error("Error notifying gateway listener: requestId={}", record.requestId(), e);
            }
        }
    }

    public void addListener(Consumer<RequestRecord> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RequestRecord> listener) {
        listeners.remove(listener);
    }

    public GatewayStats getStats() {
        List<RouteConfig> routes = routeTable.getAll();
        long services = routes.stream().map(RouteConfig::getServiceName).distinct().count();
        return new GatewayStats(
                routes.size(),
                (int) services,
                pipeline.getRemainingCapacity(),
                loadBalancer.getStats(),
                breakers.getAllStats()
        );
    }

    public boolean isRunning() {
        return pipeline.isRunning();
    }

    @Override
    public void close() {
        pipeline.close();
        log.info("API gateway stopped");
    }

    public record GatewayStats(
            int totalRoutes,
            int registeredServices,
            long ringBufferRemaining,
            LoadBalancer.LoadBalancerStats loadBalancer,
            Map<String, CircuitBreakerStats> circuitBreakers
    ) {
    }
}
