package fr.lapetina.gateway;

import fr.lapetina.gateway.domain.model.Protocol;
import fr.lapetina.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.gateway.domain.strategy.StrategyFactory;
import fr.lapetina.gateway.infrastructure.balancer.LoadBalancer;
import fr.lapetina.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.gateway.infrastructure.discovery.HealthChecker;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerConfig;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerRegistry;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;
import fr.lapetina.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.gateway.lifecycle.ServiceDefinition;
import fr.lapetina.gateway.lifecycle.ServiceManager;
import fr.lapetina.gateway.routing.ApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating a fully-wired gateway from configuration.
 * This is the primary entry point for obtaining the gateway components.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     ApiGateway gateway = factory.getGateway();
 *     // use gateway...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerRegistry breakers;
    private final ServiceRegistry serviceRegistry;
    private final GatewayHttpClient httpClient;
    private final HealthChecker healthChecker;
    private final LoadBalancer loadBalancer;
    private final RateLimiter rateLimiter;
    private final ApiGateway gateway;
    private final ServiceManager serviceManager;

    protected GatewayFactory(String configPath, GatewayHttpClient httpClientOverride) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath).load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.breakers = new CircuitBreakerRegistry(createBreakerConfig());
        breakers.onBreakerCreated(metricsRegistry::registerBreaker);

        this.serviceRegistry = new ServiceRegistry();
        serviceRegistry.addListener(event -> {
            if (event.type() == ServiceRegistry.RegistryEvent.Type.DEREGISTERED) {
                metricsRegistry.removeInstance(event.instance().getId());
            }
        });

        // Allow override for testing
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        this.healthChecker = new HealthChecker(serviceRegistry, httpClient, breakers, createHealthSettings());

        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy().getType(),
                StrategyFactory.create(StrategyFactory.DEFAULT_STRATEGY).orElseThrow()
        );
        log.info("Using load balancing strategy: {}", strategy.getName());
        this.loadBalancer = new LoadBalancer(serviceRegistry, strategy);
        loadBalancer.onMetricsCreated(metricsRegistry::registerInstance);

        this.rateLimiter = new RateLimiter(Duration.ofMillis(config.getRateLimit().getCleanupIntervalMs()));

        this.gateway = new ApiGateway(loadBalancer, breakers, rateLimiter, httpClient,
                metricsRegistry, config.getDisruptor());

        this.serviceManager = new ServiceManager(serviceRegistry, healthChecker, gateway, loadBalancer, httpClient,
                new ServiceManager.Settings(
                        Duration.ofMillis(config.getLifecycle().getHealthPollIntervalMs()),
                        Duration.ofMillis(config.getLifecycle().getProbeTimeoutMs())
                ));

        loadRoutes();
        loadServices();

        log.info("GatewayFactory initialized: services={}, routes={}",
                config.getServices().size(), gateway.getRoutes().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static GatewayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the request pipeline, the health checker and the rate limiter
     * housekeeping; starts the managed services when configured to.
     */
    public GatewayFactory start() {
        gateway.start();
        healthChecker.start();
        rateLimiter.start();
        if (config.getLifecycle().isAutoStart()) {
            serviceManager.startAllServices().whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Managed service startup aborted: {}", error.getMessage());
                }
            });
        }
        log.info("Gateway started");
        return this;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public CircuitBreakerRegistry getBreakers() {
        return breakers;
    }

    public ServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }

    public GatewayHttpClient getHttpClient() {
        return httpClient;
    }

    public HealthChecker getHealthChecker() {
        return healthChecker;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public ApiGateway getGateway() {
        return gateway;
    }

    public ServiceManager getServiceManager() {
        return serviceManager;
    }

    public Duration getDefaultRouteTimeout() {
        return Duration.ofMillis(config.getTimeouts().getDefaultRouteTimeoutMs());
    }

    private GatewayHttpClient createHttpClient() {
        return new GatewayHttpClient(Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()));
    }

    private CircuitBreakerConfig createBreakerConfig() {
        GatewayConfig.CircuitBreakerSettings settings = config.getCircuitBreaker();
        return new CircuitBreakerConfig(
                settings.getFailureThreshold(),
                Duration.ofMillis(settings.getRecoveryTimeoutMs()),
                settings.getSuccessThreshold(),
                Duration.ofMillis(settings.getTimeoutMs()),
                Duration.ofMillis(settings.getMonitoringPeriodMs())
        );
    }

    private HealthChecker.Settings createHealthSettings() {
        GatewayConfig.HealthCheckConfig healthCheck = config.getHealthCheck();
        Duration timeout = Duration.ofMillis(healthCheck.getTimeoutMs());
        return new HealthChecker.Settings(
                Duration.ofMillis(healthCheck.getIntervalMs()),
                timeout,
                createBreakerConfig()
                        .withFailureThreshold(healthCheck.getFailureThreshold())
                        .withRecoveryTimeout(Duration.ofMillis(healthCheck.getRecoveryTimeoutMs()))
                        .withTimeout(timeout)
        );
    }

    private void loadRoutes() {
        for (GatewayConfig.RouteEntry entry : config.getRoutes()) {
            gateway.registerRoute(entry.toRouteConfig(null, getDefaultRouteTimeout()));
        }
    }

    private void loadServices() {
        for (GatewayConfig.ServiceConfig serviceConfig : config.getServices()) {
            ServiceDefinition.Builder builder = ServiceDefinition.builder()
                    .name(serviceConfig.getName())
                    .version(serviceConfig.getVersion())
                    .host(serviceConfig.getHost())
                    .port(serviceConfig.getPort())
                    .protocol(Protocol.fromString(serviceConfig.getProtocol()))
                    .healthEndpoint(serviceConfig.getHealthEndpoint())
                    .tags(serviceConfig.getTags())
                    .dependencies(serviceConfig.getDependencies())
                    .metadata(serviceConfig.getMetadata())
                    .startupTimeout(Duration.ofMillis(serviceConfig.getStartupTimeoutMs()))
                    .shutdownTimeout(Duration.ofMillis(serviceConfig.getShutdownTimeoutMs()));
            for (GatewayConfig.RouteEntry entry : serviceConfig.getRoutes()) {
                builder.addRoute(entry.toRouteConfig(serviceConfig.getName(), getDefaultRouteTimeout()));
            }
            serviceManager.registerService(builder.build());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            serviceManager.stopAllServices().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping managed services");
        } catch (Exception e) {
            log.warn("Error stopping managed services", e);
        }

        try {
            serviceManager.close();
        } catch (Exception e) {
            log.warn("Error closing service manager", e);
        }

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            gateway.close();
        } catch (Exception e) {
            log.warn("Error closing gateway", e);
        }

        try {
            rateLimiter.close();
        } catch (Exception e) {
            log.warn("Error closing rate limiter", e);
        }

        try {
            breakers.close();
        } catch (Exception e) {
            log.warn("Error closing circuit breakers", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}
