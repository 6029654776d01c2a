package fr.lapetina.gateway.infrastructure.config;

import fr.lapetina.gateway.domain.exception.ConfigurationException;
import fr.lapetina.gateway.domain.model.Protocol;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.strategy.StrategyFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private StrategyConfig strategy = new StrategyConfig();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<ServiceConfig> services = new ArrayList<>();
    private List<RouteEntry> routes = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public CircuitBreakerSettings getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public LifecycleConfig getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleConfig lifecycle) { this.lifecycle = lifecycle; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<ServiceConfig> getServices() { return services; }
    public void setServices(List<ServiceConfig> services) { this.services = services; }

    public List<RouteEntry> getRoutes() { return routes; }
    public void setRoutes(List<RouteEntry> routes) { this.routes = routes; }

    /**
     * Checks the loaded values.
     *
     * @throws ConfigurationException naming the first offending field
     */
    public void validate() {
        positive("server.workerThreads", server.getWorkerThreads());
        if (server.getPort() < 0 || server.getPort() > 65535) {
            throw new ConfigurationException("server.port out of range: " + server.getPort());
        }
        if (!StrategyFactory.isKnown(strategy.getType())) {
            throw new ConfigurationException("strategy.type is unknown: " + strategy.getType()
                    + " (available: " + StrategyFactory.getRegisteredNames() + ")");
        }

        positive("circuitBreaker.failureThreshold", circuitBreaker.getFailureThreshold());
        positive("circuitBreaker.successThreshold", circuitBreaker.getSuccessThreshold());
        positive("circuitBreaker.recoveryTimeoutMs", circuitBreaker.getRecoveryTimeoutMs());
        positive("circuitBreaker.timeoutMs", circuitBreaker.getTimeoutMs());
        positive("circuitBreaker.monitoringPeriodMs", circuitBreaker.getMonitoringPeriodMs());

        positive("healthCheck.intervalMs", healthCheck.getIntervalMs());
        positive("healthCheck.timeoutMs", healthCheck.getTimeoutMs());
        positive("healthCheck.failureThreshold", healthCheck.getFailureThreshold());
        positive("healthCheck.recoveryTimeoutMs", healthCheck.getRecoveryTimeoutMs());

        positive("rateLimit.cleanupIntervalMs", rateLimit.getCleanupIntervalMs());

        int ringBufferSize = disruptor.getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("disruptor.ringBufferSize must be a power of 2: " + ringBufferSize);
        }

        positive("timeouts.connectTimeoutMs", timeouts.getConnectTimeoutMs());
        positive("timeouts.defaultRouteTimeoutMs", timeouts.getDefaultRouteTimeoutMs());
        positive("lifecycle.healthPollIntervalMs", lifecycle.getHealthPollIntervalMs());
        positive("lifecycle.probeTimeoutMs", lifecycle.getProbeTimeoutMs());

        Set<String> names = new HashSet<>();
        for (int i = 0; i < services.size(); i++) {
            ServiceConfig service = services.get(i);
            String field = "services[" + i + "]";
            if (isBlank(service.getName())) {
                throw new ConfigurationException(field + ".name is required");
            }
            if (!names.add(service.getName())) {
                throw new ConfigurationException(field + ".name is duplicated: " + service.getName());
            }
            if (isBlank(service.getHost())) {
                throw new ConfigurationException(field + ".host is required");
            }
            if (service.getPort() <= 0 || service.getPort() > 65535) {
                throw new ConfigurationException(field + ".port out of range: " + service.getPort());
            }
            try {
                Protocol.fromString(service.getProtocol());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(field + ".protocol is invalid: " + service.getProtocol(), e);
            }
            positive(field + ".startupTimeoutMs", service.getStartupTimeoutMs());
            positive(field + ".shutdownTimeoutMs", service.getShutdownTimeoutMs());
            for (int j = 0; j < service.getRoutes().size(); j++) {
                validateRoute(field + ".routes[" + j + "]", service.getRoutes().get(j), service.getName());
            }
        }
        for (int i = 0; i < routes.size(); i++) {
            validateRoute("routes[" + i + "]", routes.get(i), null);
        }
    }

    private static void validateRoute(String field, RouteEntry route, String owningService) {
        if (isBlank(route.getMethod())) {
            throw new ConfigurationException(field + ".method is required");
        }
        if (isBlank(route.getPath()) || !route.getPath().startsWith("/")) {
            throw new ConfigurationException(field + ".path must start with '/': " + route.getPath());
        }
        if (isBlank(route.getServiceName()) && owningService == null) {
            throw new ConfigurationException(field + ".serviceName is required");
        }
        if (route.getTimeoutMs() != null) {
            positive(field + ".timeoutMs", route.getTimeoutMs());
        }
        RateLimitEntry limit = route.getRateLimit();
        if (limit != null && limit.getPreset() != null
                && !"voice".equals(limit.getPreset()) && !"api".equals(limit.getPreset())) {
            throw new ConfigurationException(field + ".rateLimit.preset is unknown: " + limit.getPreset());
        }
        if (limit != null && limit.getPreset() == null) {
            positive(field + ".rateLimit.windowMs", limit.getWindowMs());
            positive(field + ".rateLimit.maxRequests", limit.getMaxRequests());
            positive(field + ".rateLimit.queueTimeoutMs", limit.getQueueTimeoutMs());
            if (limit.getQueueSize() < 0) {
                throw new ConfigurationException(field + ".rateLimit.queueSize must not be negative");
            }
        }
    }

    private static void positive(String field, long value) {
        if (value <= 0) {
            throw new ConfigurationException(field + " must be positive: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Inbound HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 32;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Load balancing strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "health_based";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Defaults for proxy circuit breakers.
     */
    public static class CircuitBreakerSettings {
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 60000;
        private int successThreshold = 3;
        private long timeoutMs = 30000;
        private long monitoringPeriodMs = 300000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getMonitoringPeriodMs() { return monitoringPeriodMs; }
        public void setMonitoringPeriodMs(long monitoringPeriodMs) { this.monitoringPeriodMs = monitoringPeriodMs; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private long intervalMs = 30000;
        private long timeoutMs = 5000;
        private int failureThreshold = 3;
        private long recoveryTimeoutMs = 30000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }
    }

    /**
     * Rate limiter housekeeping.
     */
    public static class RateLimitConfig {
        private long cleanupIntervalMs = 60000;

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long defaultRouteTimeoutMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getDefaultRouteTimeoutMs() { return defaultRouteTimeoutMs; }
        public void setDefaultRouteTimeoutMs(long defaultRouteTimeoutMs) { this.defaultRouteTimeoutMs = defaultRouteTimeoutMs; }
    }

    /**
     * Service Manager settings.
     */
    public static class LifecycleConfig {
        private long healthPollIntervalMs = 2000;
        private long probeTimeoutMs = 5000;
        private boolean autoStart = false;

        public long getHealthPollIntervalMs() { return healthPollIntervalMs; }
        public void setHealthPollIntervalMs(long healthPollIntervalMs) { this.healthPollIntervalMs = healthPollIntervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "gateway";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Declarative service definition managed by the Service Manager.
     */
    public static class ServiceConfig {
        private String name;
        private String version = "1.0.0";
        private String host = "localhost";
        private int port;
        private String protocol = "http";
        private String healthEndpoint = "/health";
        private Set<String> tags = new LinkedHashSet<>();
        private List<String> dependencies = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private long startupTimeoutMs = 30000;
        private long shutdownTimeoutMs = 10000;
        private List<RouteEntry> routes = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getProtocol() { return protocol; }
        public void setProtocol(String protocol) { this.protocol = protocol; }

        public String getHealthEndpoint() { return healthEndpoint; }
        public void setHealthEndpoint(String healthEndpoint) { this.healthEndpoint = healthEndpoint; }

        public Set<String> getTags() { return tags; }
        public void setTags(Set<String> tags) { this.tags = tags; }

        public List<String> getDependencies() { return dependencies; }
        public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }

        public Map<String, Object> getMetadata() { return metadata; }
        public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

        public long getStartupTimeoutMs() { return startupTimeoutMs; }
        public void setStartupTimeoutMs(long startupTimeoutMs) { this.startupTimeoutMs = startupTimeoutMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }

        public List<RouteEntry> getRoutes() { return routes; }
        public void setRoutes(List<RouteEntry> routes) { this.routes = routes; }
    }

    /**
     * A gateway route. {@code serviceName} may be omitted under a service.
     */
    public static class RouteEntry {
        private String method = "GET";
        private String path;
        private String serviceName;
        private String targetPath;
        private Set<String> tags = new LinkedHashSet<>();
        private Long timeoutMs;
        private RateLimitEntry rateLimit;

        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getServiceName() { return serviceName; }
        public void setServiceName(String serviceName) { this.serviceName = serviceName; }

        public String getTargetPath() { return targetPath; }
        public void setTargetPath(String targetPath) { this.targetPath = targetPath; }

        public Set<String> getTags() { return tags; }
        public void setTags(Set<String> tags) { this.tags = tags; }

        public Long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

        public RateLimitEntry getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitEntry rateLimit) { this.rateLimit = rateLimit; }

        /**
         * Builds the runtime route.
         *
         * @param owningService service the route is declared under, or null for a top-level route
         * @param defaultTimeout timeout used when none is set
         */
        public RouteConfig toRouteConfig(String owningService, Duration defaultTimeout) {
            return RouteConfig.builder()
                    .method(method)
                    .path(path)
                    .serviceName(serviceName != null ? serviceName : owningService)
                    .targetPath(targetPath)
                    .tags(tags)
                    .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : defaultTimeout)
                    .rateLimit(rateLimit != null ? rateLimit.toRule() : null)
                    .build();
        }
    }

    /**
     * Per-route limit, either a named preset ({@code voice}, {@code api}) or explicit values.
     */
    public static class RateLimitEntry {
        private String preset;
        private long windowMs = 60000;
        private int maxRequests = 100;
        private int queueSize = 10;
        private long queueTimeoutMs = 30000;

        public String getPreset() { return preset; }
        public void setPreset(String preset) { this.preset = preset; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }

        public long getQueueTimeoutMs() { return queueTimeoutMs; }
        public void setQueueTimeoutMs(long queueTimeoutMs) { this.queueTimeoutMs = queueTimeoutMs; }

        public RateLimitRule toRule() {
            if ("voice".equals(preset)) {
                return RateLimitRule.voice();
            }
            if ("api".equals(preset)) {
                return RateLimitRule.api();
            }
            return RateLimitRule.of(windowMs, maxRequests, queueSize, queueTimeoutMs);
        }
    }
}
