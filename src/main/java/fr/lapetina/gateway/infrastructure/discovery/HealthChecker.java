package fr.lapetina.gateway.infrastructure.discovery;

import fr.lapetina.gateway.domain.model.HealthCheckResult;
import fr.lapetina.gateway.domain.model.HealthStatus;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.http.CircuitBreaker;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerConfig;
import fr.lapetina.gateway.infrastructure.http.CircuitBreakerRegistry;
import fr.lapetina.gateway.infrastructure.http.GatewayHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background health checker for registered service instances.
 *
 * Probes every instance on a fixed delay, independently of request traffic.
 * Each probe goes through a circuit breaker keyed {@code health-check-<service>}
 * and is cancelled at its timeout. Probes within a cycle run concurrently and
 * never fail each other; a failed probe only marks its own instance unhealthy.
 * Newly registered instances are probed immediately.
 */
public final class HealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final ServiceRegistry registry;
    private final GatewayHttpClient httpClient;
    private final CircuitBreakerRegistry breakers;
    private final Settings settings;
    private final ScheduledExecutorService scheduler;
    private final Map<String, HealthCheckResult> lastResults = new ConcurrentHashMap<>();
    private final List<Consumer<HealthCheckResult>> listeners = new CopyOnWriteArrayList<>();
    private final Consumer<ServiceRegistry.RegistryEvent> registryListener = this::onRegistryEvent;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> cycleTask;

    public HealthChecker(
            ServiceRegistry registry,
            GatewayHttpClient httpClient,
            CircuitBreakerRegistry breakers,
            Settings settings
    ) {
        this.registry = registry;
        this.httpClient = httpClient;
        this.breakers = breakers;
        this.settings = settings;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
        registry.addListener(registryListener);
    }

    public HealthChecker(ServiceRegistry registry, GatewayHttpClient httpClient, CircuitBreakerRegistry breakers) {
        this(registry, httpClient, breakers, Settings.defaults());
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Health checker is closed");
        }
        if (running.compareAndSet(false, true)) {
            cycleTask = scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    settings.interval().toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started: intervalMs={}, timeoutMs={}",
                    settings.interval().toMillis(), settings.timeout().toMillis());
        }
    }

    private void runCycle() {
        try {
            checkAll().join();
        } catch (RuntimeException e) {
            // Keep the schedule alive; an exception would cancel it
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes all registered instances concurrently.
     */
    public CompletableFuture<List<HealthCheckResult>> checkAll() {
        List<ServiceInstance> instances = registry.getAllInstances();
        log.debug("Starting health check cycle: instanceCount={}", instances.size());

        List<CompletableFuture<HealthCheckResult>> probes = instances.stream()
                .map(this::checkInstance)
                .toList();

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> probes.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Probes one instance and applies the outcome to the registry.
     * The returned future always completes normally.
     */
    public CompletableFuture<HealthCheckResult> checkInstance(ServiceInstance instance) {
        CircuitBreaker breaker = breakers.get(
                "health-check-" + instance.getName(),
                settings.breakerConfig().withTimeout(settings.timeout())
        );
        long startNanos = System.nanoTime();

        CompletableFuture<HealthCheckResult> probe;
        try {
            probe = breaker.execute(() -> httpClient.probe(instance, settings.timeout()), settings.timeout())
                    .thenApply(response -> {
                        HealthStatus status = HealthStatusEvaluator.evaluate(response.body());
                        return new HealthCheckResult(instance.getId(), instance.getName(), status,
                                response.responseTimeMs(), HealthStatusEvaluator.details(response.body()),
                                null, Instant.now());
                    });
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }

        return probe
                .exceptionally(error -> {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
                    return HealthCheckResult.failed(instance, elapsedMs, describe(cause));
                })
                .thenApply(result -> {
                    applyResult(instance, result);
                    return result;
                });
    }

    private void applyResult(ServiceInstance instance, HealthCheckResult result) {
        // Results for instances deregistered mid-probe are dropped
        if (registry.getInstance(instance.getName(), instance.getId()).orElse(null) != instance) {
            log.debug("Health result dropped for removed instance: name={}, id={}",
                    instance.getName(), instance.getId());
            return;
        }
        lastResults.put(instance.getId(), result);
        registry.updateStatus(instance, result.status().toInstanceStatus());

        if (result.status() == HealthStatus.UNHEALTHY) {
            log.warn("Health check failed: name={}, id={}, error={}",
                    instance.getName(), instance.getId(), result.error());
        } else {
            log.debug("Health check completed: name={}, id={}, status={}, responseTimeMs={}",
                    instance.getName(), instance.getId(), result.status(), result.responseTimeMs());
        }

        for (Consumer<HealthCheckResult> listener : listeners) {
            try {
                listener.accept(result);
            } catch (Exception e) {
                log.error("Error notifying health listener: id={}", instance.getId(), e);
            }
        }
    }

    private void onRegistryEvent(ServiceRegistry.RegistryEvent event) {
        switch (event.type()) {
            case REGISTERED -> {
                if (!closed.get()) {
                    checkInstance(event.instance());
                }
            }
            case DEREGISTERED -> lastResults.remove(event.instance().getId());
            default -> {
                // Status transitions originate here
            }
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    public Optional<HealthCheckResult> getLastResult(String instanceId) {
        return Optional.ofNullable(lastResults.get(instanceId));
    }

    public List<HealthCheckResult> getAllResults() {
        return lastResults.values().stream()
                .sorted(Comparator.comparing(HealthCheckResult::serviceName)
                        .thenComparing(HealthCheckResult::instanceId))
                .toList();
    }

    /**
     * Overall health from the latest results: HEALTHY when every probed
     * instance is healthy, DEGRADED when some are, UNHEALTHY when none are.
     */
    public SystemHealth getSystemHealth() {
        List<HealthCheckResult> results = getAllResults();
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        for (HealthCheckResult result : results) {
            switch (result.status()) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> unhealthy++;
            }
        }
        HealthStatus overall;
        if (healthy == results.size()) {
            overall = HealthStatus.HEALTHY;
        } else if (healthy > 0) {
            overall = HealthStatus.DEGRADED;
        } else {
            overall = HealthStatus.UNHEALTHY;
        }
        return new SystemHealth(overall, healthy, degraded, unhealthy, results.size(), results, Instant.now());
    }

    public void addListener(Consumer<HealthCheckResult> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<HealthCheckResult> listener) {
        listeners.remove(listener);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            running.set(false);
            registry.removeListener(registryListener);
            ScheduledFuture<?> task = cycleTask;
            if (task != null) {
                task.cancel(false);
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health checker stopped");
        }
    }

    /**
     * Health checker settings.
     *
     * @param interval      delay between cycles
     * @param timeout       per-probe timeout
     * @param breakerConfig config for the per-service probe breakers
     */
    public record Settings(Duration interval, Duration timeout, CircuitBreakerConfig breakerConfig) {
        public static Settings defaults() {
            return new Settings(
                    Duration.ofSeconds(30),
                    Duration.ofSeconds(5),
                    CircuitBreakerConfig.defaults()
                            .withFailureThreshold(3)
                            .withRecoveryTimeout(Duration.ofSeconds(30))
                            .withTimeout(Duration.ofSeconds(5))
            );
        }
    }

    /**
     * Aggregate health across all probed instances.
     */
    public record SystemHealth(
            HealthStatus overall,
            int healthy,
            int degraded,
            int unhealthy,
            int total,
            List<HealthCheckResult> results,
            Instant timestamp
    ) {
    }
}
