package fr.lapetina.gateway.infrastructure.metrics;

import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.infrastructure.http.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Gateway request counters and latency timers per service and status
 * - Error counters by type
 * - Circuit breaker state and per-instance connection gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Gauge> breakerGauges = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Gauge> instanceGauges = new ConcurrentHashMap<>();

    private final AtomicInteger registeredInstances = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_registered_instances", registeredInstances, AtomicInteger::get)
                .description("Number of registered service instances")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the request ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}", prefix);
    }

    public MetricsRegistry() {
        this("gateway");
    }

    /**
     * Counts a gateway request and records its latency.
     */
    public void recordRequest(String service, int status, Duration latency) {
        String statusTag = String.valueOf(status);
        String key = service + ":" + statusTag;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of gateway requests")
                        .tag("service", service)
                        .tag("status", statusTag)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Gateway request latency")
                        .tag("service", service)
                        .tag("status", statusTag)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of gateway errors")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a state gauge for a breaker (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     */
    public void registerBreaker(CircuitBreaker breaker) {
        breakerGauges.computeIfAbsent(breaker.getName(), name ->
                Gauge.builder(prefix + "_circuit_breaker_state", breaker, MetricsRegistry::stateValue)
                        .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                        .tag("breaker", name)
                        .strongReference(true)
                        .register(registry)
        );
    }

    /**
     * Registers an active-connections gauge for an instance.
     */
    public void registerInstance(InstanceMetrics metrics) {
        Gauge previous = instanceGauges.put(metrics.getInstanceId(),
                Gauge.builder(prefix + "_instance_active_connections", metrics, InstanceMetrics::getActiveConnections)
                        .description("Active proxied connections per instance")
                        .tag("instance", metrics.getInstanceId())
                        .strongReference(true)
                        .register(registry));
        if (previous == null) {
            registeredInstances.incrementAndGet();
        }
    }

    /**
     * Removes the gauges of a deregistered instance.
     */
    public void removeInstance(String instanceId) {
        Gauge gauge = instanceGauges.remove(instanceId);
        if (gauge != null) {
            registry.remove(gauge);
            registeredInstances.decrementAndGet();
        }
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private static double stateValue(CircuitBreaker breaker) {
        return switch (breaker.getState()) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    @Override
    public void close() {
        registry.close();
    }
}
