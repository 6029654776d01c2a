package fr.lapetina.gateway.lifecycle;

import fr.lapetina.gateway.domain.exception.ConfigurationException;
import fr.lapetina.gateway.domain.model.HealthCheckResult;
import fr.lapetina.gateway.domain.model.HealthStatus;
import fr.lapetina.gateway.domain.model.InstanceStatus;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.balancer.LoadBalancer;
import fr.lapetina.gateway.infrastructure.discovery.HealthChecker;
import fr.lapetina.gateway.infrastructure.discovery.HealthStatusEvaluator;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;
import fr.lapetina.gateway.routing.ApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Starts and stops managed services in dependency order.
 *
 * A start checks that every dependency has a healthy instance, registers a
 * fresh instance and polls its health endpoint until it answers 2xx or the
 * startup timeout passes. A stop deregisters the service's instances and
 * waits, within the shutdown timeout, for their in-flight calls to finish.
 * Bulk starts abort on the first failing {@link ServiceDefinition#isCritical() critical}
 * service; bulk stops log failures and carry on.
 */
public final class ServiceManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceManager.class);

    private static final Duration DRAIN_POLL_INTERVAL = Duration.ofMillis(100);

    private final ServiceRegistry registry;
    private final HealthChecker healthChecker;
    private final ApiGateway gateway;
    private final LoadBalancer loadBalancer;
    private final GatewayHttpClient httpClient;
    private final Settings settings;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ManagedService> services = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Consumer<LifecycleEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Consumer<HealthCheckResult> healthListener = this::onHealthResult;

    public ServiceManager(
            ServiceRegistry registry,
            HealthChecker healthChecker,
            ApiGateway gateway,
            LoadBalancer loadBalancer,
            GatewayHttpClient httpClient,
            Settings settings
    ) {
        this.registry = registry;
        this.healthChecker = healthChecker;
        this.gateway = gateway;
        this.loadBalancer = loadBalancer;
        this.httpClient = httpClient;
        this.settings = settings;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "service-manager");
            t.setDaemon(true);
            return t;
        });
        healthChecker.addListener(healthListener);
    }

    /**
     * Stores a definition in the STOPPED state and exposes its routes through the gateway.
     * Registering a name again replaces the definition.
     */
    public void registerService(ServiceDefinition definition) {
        ManagedService previous = services.put(definition.getName(), new ManagedService(definition));
        if (previous != null) {
            log.warn("Service definition replaced: name={}", definition.getName());
        }
        for (RouteConfig route : definition.getRoutes()) {
            gateway.registerRoute(route);
        }
        log.info("Service registered: name={}, dependencies={}, routes={}",
                definition.getName(), definition.getDependencies(), definition.getRoutes().size());
        notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.REGISTERED, definition.getName()));
    }

    /**
     * Orders the registered services so that every service follows the
     * services it depends on. Dependencies that are not registered here are
     * ignored.
     *
     * @throws ConfigurationException if the dependencies form a cycle
     */
    public List<String> calculateStartupOrder() {
        Map<String, ServiceDefinition> definitions = definitions();
        List<String> order = new ArrayList<>(definitions.size());
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new LinkedHashSet<>();
        for (String name : definitions.keySet()) {
            visit(name, definitions, visited, visiting, order);
        }
        return order;
    }

    private static void visit(String name, Map<String, ServiceDefinition> definitions,
                              Set<String> visited, Set<String> visiting, List<String> order) {
        if (visited.contains(name)) {
            return;
        }
        if (!visiting.add(name)) {
            throw new ConfigurationException("Circular dependency detected involving: " + name);
        }
        for (String dependency : definitions.get(name).getDependencies()) {
            if (definitions.containsKey(dependency)) {
                visit(dependency, definitions, visited, visiting, order);
            }
        }
        visiting.remove(name);
        visited.add(name);
        order.add(name);
    }

    public List<String> calculateShutdownOrder() {
        List<String> order = calculateStartupOrder();
        Collections.reverse(order);
        return order;
    }

    /**
     * Starts one service. Completes with its RUNNING status, or exceptionally
     * with a {@link ServiceLifecycleException} once the service is FAILED.
     *
     * @throws ConfigurationException if no service of that name is registered
     */
    public CompletableFuture<ServiceStatus> startService(String name) {
        ManagedService service = require(name);
        if (!service.beginStart()) {
            log.debug("Start ignored: name={}, state={}", name, service.state());
            return CompletableFuture.completedFuture(service.status());
        }
        ServiceDefinition definition = service.definition;
        log.info("Starting service: name={}", name);
        notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.STARTING, name));

        Map<String, Boolean> dependencies = registry.checkDependencies(definition.getDependencies());
        service.setDependencies(dependencies);
        Optional<String> missing = dependencies.entrySet().stream()
                .filter(entry -> !entry.getValue())
                .map(Map.Entry::getKey)
                .findFirst();
        if (missing.isPresent()) {
            return fail(service, null,
                    new ServiceLifecycleException(name, "Dependency not available: " + missing.get()));
        }

        ServiceInstance instance = definition.toInstance(name + "-" + System.currentTimeMillis());
        service.setInstanceId(instance.getId());
        registry.register(instance);

        return awaitHealthy(definition, instance)
                .thenApply(ignored -> {
                    registry.updateStatus(instance, InstanceStatus.HEALTHY);
                    service.markRunning();
                    log.info("Service started: name={}, instanceId={}", name, instance.getId());
                    notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.STARTED, name));
                    return service.status();
                })
                .exceptionallyCompose(error -> fail(service, instance, error));
    }

    private CompletableFuture<Void> awaitHealthy(ServiceDefinition definition, ServiceInstance instance) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        long deadline = System.nanoTime() + definition.getStartupTimeout().toNanos();
        poll(definition.getName(), instance, deadline, ready);
        return ready;
    }

    private void poll(String name, ServiceInstance instance, long deadline, CompletableFuture<Void> ready) {
        CompletableFuture<GatewayHttpClient.HealthProbeResponse> probe;
        try {
            probe = httpClient.probe(instance, settings.probeTimeout());
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }
        probe.whenComplete((response, error) -> {
            if (error == null && isReady(response)) {
                ready.complete(null);
                return;
            }
            if (System.nanoTime() >= deadline) {
                ready.completeExceptionally(
                        new ServiceLifecycleException(name, "Service health check timeout: " + name));
                return;
            }
            log.debug("Service not ready yet: name={}, instanceId={}, status={}",
                    name, instance.getId(), error != null ? error.getMessage() : response.statusCode());
            try {
                scheduler.schedule(() -> poll(name, instance, deadline, ready),
                        settings.healthPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                ready.completeExceptionally(new ServiceLifecycleException(name, "Service manager is closed", e));
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static boolean isReady(GatewayHttpClient.HealthProbeResponse response) {
        return response.statusCode() >= 200 && response.statusCode() < 300
                && HealthStatusEvaluator.evaluate(response.body()) != HealthStatus.UNHEALTHY;
    }

    private CompletableFuture<ServiceStatus> fail(ManagedService service, ServiceInstance instance, Throwable error) {
        Throwable cause = unwrap(error);
        String name = service.definition.getName();
        if (instance != null) {
            registry.deregister(name, instance.getId());
        }
        service.markFailed(cause.getMessage());
        log.error("Service failed to start: name={}, error={}", name, cause.getMessage());
        notifyListeners(new LifecycleEvent(LifecycleEvent.Type.FAILED, name, cause));
        ServiceLifecycleException failure = cause instanceof ServiceLifecycleException lifecycle
                ? lifecycle
                : new ServiceLifecycleException(name, cause.getMessage(), cause);
        return CompletableFuture.failedFuture(failure);
    }

    /**
     * Deregisters every instance of the service and completes once their
     * in-flight calls are done or the shutdown timeout passed.
     *
     * @throws ConfigurationException if no service of that name is registered
     */
    public CompletableFuture<ServiceStatus> stopService(String name) {
        ManagedService service = require(name);
        if (!service.beginStop()) {
            log.debug("Stop ignored: name={}, state={}", name, service.state());
            return CompletableFuture.completedFuture(service.status());
        }
        log.info("Stopping service: name={}", name);
        notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.STOPPING, name));

        List<String> instanceIds = new ArrayList<>();
        for (ServiceInstance instance : registry.getInstances(name)) {
            registry.deregister(name, instance.getId());
            instanceIds.add(instance.getId());
        }

        CompletableFuture<Void> drained = new CompletableFuture<>();
        long deadline = System.nanoTime() + service.definition.getShutdownTimeout().toNanos();
        drain(name, instanceIds, deadline, drained);

        return drained.thenApply(ignored -> {
            service.markStopped();
            log.info("Service stopped: name={}, instances={}", name, instanceIds.size());
            notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.STOPPED, name));
            return service.status();
        });
    }

    private void drain(String name, List<String> instanceIds, long deadline, CompletableFuture<Void> drained) {
        int active = instanceIds.stream().mapToInt(loadBalancer::getActiveConnections).sum();
        if (active == 0) {
            drained.complete(null);
            return;
        }
        if (System.nanoTime() >= deadline) {
            log.warn("Shutdown timeout reached with calls in flight: name={}, activeConnections={}", name, active);
            drained.complete(null);
            return;
        }
        try {
            scheduler.schedule(() -> drain(name, instanceIds, deadline, drained),
                    DRAIN_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Drain abandoned, service manager is closed: name={}", name);
            drained.complete(null);
        }
    }

    /**
     * Starts every service in startup order, one after the other.
     * Completes exceptionally when a critical service fails.
     */
    public CompletableFuture<Void> startAllServices() {
        List<String> order = calculateStartupOrder();
        log.info("Starting all services: order={}", order);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String name : order) {
            chain = chain.thenCompose(ignored -> startService(name)
                    .handle((status, error) -> {
                        if (error == null) {
                            return null;
                        }
                        if (require(name).definition.isCritical()) {
                            log.error("Critical service failed, aborting startup: name={}", name);
                            throw new ServiceLifecycleException(name,
                                    "Critical service failed to start: " + name, unwrap(error));
                        }
                        log.warn("Service failed to start, continuing: name={}, error={}",
                                name, unwrap(error).getMessage());
                        return null;
                    }));
        }
        return chain.thenRun(() -> {
            log.info("All services started: {}", getStats());
            notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.ALL_STARTED, null));
        });
    }

    /**
     * Stops every service in shutdown order. Never completes exceptionally.
     */
    public CompletableFuture<Void> stopAllServices() {
        List<String> order = calculateShutdownOrder();
        log.info("Stopping all services: order={}", order);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String name : order) {
            chain = chain.thenCompose(ignored -> {
                CompletableFuture<ServiceStatus> stop;
                try {
                    stop = stopService(name);
                } catch (RuntimeException e) {
                    stop = CompletableFuture.failedFuture(e);
                }
                return stop.handle((status, error) -> {
                    if (error != null) {
                        log.error("Error stopping service: name={}", name, error);
                    }
                    return null;
                });
            });
        }
        return chain.thenRun(() -> {
            log.info("All services stopped");
            notifyListeners(LifecycleEvent.of(LifecycleEvent.Type.ALL_STOPPED, null));
        });
    }

    public Optional<ServiceStatus> getServiceStatus(String name) {
        return Optional.ofNullable(services.get(name)).map(ManagedService::status);
    }

    public List<ServiceStatus> getAllServiceStatuses() {
        synchronized (services) {
            return services.values().stream().map(ManagedService::status).toList();
        }
    }

    public Optional<ServiceDefinition> getDefinition(String name) {
        return Optional.ofNullable(services.get(name)).map(service -> service.definition);
    }

    public LifecycleStats getStats() {
        List<ServiceStatus> statuses = getAllServiceStatuses();
        int running = (int) statuses.stream().filter(s -> s.state() == LifecycleState.RUNNING).count();
        int failed = (int) statuses.stream().filter(s -> s.state() == LifecycleState.FAILED).count();
        return new LifecycleStats(statuses.size(), running, failed);
    }

    public void addListener(Consumer<LifecycleEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<LifecycleEvent> listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        healthChecker.removeListener(healthListener);
        scheduler.shutdownNow();
        log.info("Service manager stopped");
    }

    private void onHealthResult(HealthCheckResult result) {
        ManagedService service = services.get(result.serviceName());
        if (service != null && result.instanceId().equals(service.instanceId())) {
            service.setHealth(result.status());
        }
    }

    private ManagedService require(String name) {
        ManagedService service = services.get(name);
        if (service == null) {
            throw new ConfigurationException("Unknown service: " + name);
        }
        return service;
    }

    private Map<String, ServiceDefinition> definitions() {
        Map<String, ServiceDefinition> snapshot = new LinkedHashMap<>();
        synchronized (services) {
            services.forEach((name, service) -> snapshot.put(name, service.definition));
        }
        return snapshot;
    }

    private void notifyListeners(LifecycleEvent event) {
        for (Consumer<LifecycleEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying lifecycle listener: event={}, service={}",
                        event.type(), event.serviceName(), e);
            }
        }
    }

    /**
     * Service manager settings.
     *
     * @param healthPollInterval delay between startup probes
     * @param probeTimeout       timeout of one startup probe
     */
    public record Settings(Duration healthPollInterval, Duration probeTimeout) {
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(2), Duration.ofSeconds(5));
        }
    }

    public record LifecycleStats(int totalServices, int running, int failed) {
    }

    /**
     * Mutable runtime state of one registered service.
     */
    private static final class ManagedService {
        private final ServiceDefinition definition;
        private LifecycleState state = LifecycleState.STOPPED;
        private HealthStatus health;
        private Instant startedAt;
        private Instant stoppedAt;
        private String error;
        private Map<String, Boolean> dependencies = Map.of();
        private String instanceId;

        ManagedService(ServiceDefinition definition) {
            this.definition = definition;
        }

        synchronized boolean beginStart() {
            if (state == LifecycleState.RUNNING || state == LifecycleState.STARTING) {
                return false;
            }
            state = LifecycleState.STARTING;
            error = null;
            health = null;
            return true;
        }

        synchronized boolean beginStop() {
            if (state == LifecycleState.STOPPED || state == LifecycleState.STOPPING) {
                return false;
            }
            state = LifecycleState.STOPPING;
            return true;
        }

        synchronized void markRunning() {
            state = LifecycleState.RUNNING;
            health = HealthStatus.HEALTHY;
            startedAt = Instant.now();
        }

        synchronized void markFailed(String message) {
            state = LifecycleState.FAILED;
            health = HealthStatus.UNHEALTHY;
            error = message;
            instanceId = null;
        }

        synchronized void markStopped() {
            state = LifecycleState.STOPPED;
            stoppedAt = Instant.now();
            health = null;
            instanceId = null;
        }

        synchronized void setDependencies(Map<String, Boolean> dependencies) {
            this.dependencies = dependencies;
        }

        synchronized void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }

        synchronized void setHealth(HealthStatus health) {
            if (state == LifecycleState.RUNNING) {
                this.health = health;
            }
        }

        synchronized String instanceId() {
            return instanceId;
        }

        synchronized LifecycleState state() {
            return state;
        }

        synchronized ServiceStatus status() {
            return new ServiceStatus(definition.getName(), state, health, startedAt, stoppedAt,
                    error, dependencies, instanceId);
        }
    }
}
