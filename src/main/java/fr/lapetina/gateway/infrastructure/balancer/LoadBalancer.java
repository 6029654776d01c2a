package fr.lapetina.gateway.infrastructure.balancer;

import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.gateway.domain.strategy.MetricsLookup;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Selects instances for a service using the configured strategy and keeps
 * rolling per-instance metrics.
 *
 * Metrics entries follow registry events: created on registration and
 * dropped on deregistration. Re-registering a known id keeps its entry, so
 * in-flight connection counts survive an upsert.
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final ServiceRegistry registry;
    private final AtomicReference<LoadBalancingStrategy> strategy;
    private final Map<String, InstanceMetrics> metrics = new ConcurrentHashMap<>();
    // Deregistered instances that still had calls in flight
    private final Map<String, InstanceMetrics> draining = new ConcurrentHashMap<>();
    private final List<Consumer<InstanceMetrics>> metricsListeners = new CopyOnWriteArrayList<>();
    private final MetricsLookup lookup = instanceId -> Optional.ofNullable(metrics.get(instanceId));

    public LoadBalancer(ServiceRegistry registry, LoadBalancingStrategy strategy) {
        this.registry = registry;
        this.strategy = new AtomicReference<>(strategy);
        registry.getAllInstances().forEach(this::initializeMetrics);
        registry.addListener(this::onRegistryEvent);
        log.info("Load balancer initialized: strategy={}", strategy.getName());
    }

    /**
     * Picks a healthy instance of the service carrying all requested tags.
     */
    public Optional<ServiceInstance> select(String serviceName, Set<String> tags) {
        List<ServiceInstance> candidates = registry.discover(serviceName, tags);
        if (candidates.isEmpty()) {
            log.warn("No healthy instances available: service={}, tags={}", serviceName, tags);
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }

        LoadBalancingStrategy current = strategy.get();
        Optional<ServiceInstance> selected = current.select(serviceName, candidates, lookup);
        selected.ifPresent(instance -> log.debug("Instance selected: service={}, id={}, strategy={}",
                serviceName, instance.getId(), current.getName()));
        return selected;
    }

    public Optional<ServiceInstance> select(String serviceName) {
        return select(serviceName, Set.of());
    }

    /**
     * Updates the moving averages of an instance after a call.
     */
    public void recordRequest(String instanceId, long responseTimeMs, boolean success) {
        InstanceMetrics entry = metrics.get(instanceId);
        if (entry != null) {
            entry.recordRequest(responseTimeMs, success);
        }
    }

    public void recordConnectionStart(String instanceId) {
        InstanceMetrics entry = metrics.get(instanceId);
        if (entry != null) {
            entry.connectionStarted();
        }
    }

    public void recordConnectionEnd(String instanceId) {
        InstanceMetrics entry = metrics.get(instanceId);
        if (entry != null) {
            entry.connectionEnded();
            return;
        }
        InstanceMetrics drained = draining.get(instanceId);
        if (drained != null && drained.connectionEnded() == 0) {
            draining.remove(instanceId, drained);
            log.debug("Instance drained: id={}", instanceId);
        }
    }

    /**
     * In-flight calls to an instance, including one deregistered while calls were running.
     */
    public int getActiveConnections(String instanceId) {
        InstanceMetrics entry = metrics.get(instanceId);
        if (entry == null) {
            entry = draining.get(instanceId);
        }
        return entry != null ? entry.getActiveConnections() : 0;
    }

    public Optional<InstanceMetrics> getMetrics(String instanceId) {
        return Optional.ofNullable(metrics.get(instanceId));
    }

    /**
     * Changes the load balancing strategy at runtime.
     */
    public void setStrategy(LoadBalancingStrategy newStrategy) {
        LoadBalancingStrategy old = strategy.getAndSet(newStrategy);
        log.info("Load balancing strategy changed: {} -> {}", old.getName(), newStrategy.getName());
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy.get();
    }

    public LoadBalancerStats getStats() {
        List<InstanceMetrics.Snapshot> snapshots = metrics.values().stream()
                .map(InstanceMetrics::snapshot)
                .sorted(Comparator.comparing(InstanceMetrics.Snapshot::instanceId))
                .toList();
        long totalRequests = snapshots.stream().mapToLong(InstanceMetrics.Snapshot::totalRequests).sum();
        double averageResponseTime = snapshots.isEmpty() ? 0.0 : snapshots.stream()
                .mapToDouble(InstanceMetrics.Snapshot::averageResponseTime)
                .average()
                .orElse(0.0);
        return new LoadBalancerStats(
                strategy.get().getName(),
                registry.getAllServices().size(),
                totalRequests,
                averageResponseTime,
                snapshots
        );
    }

    /**
     * Notified once for every metrics entry created, e.g. to register gauges.
     */
    public void onMetricsCreated(Consumer<InstanceMetrics> listener) {
        metricsListeners.add(listener);
        metrics.values().forEach(listener);
    }

    private void onRegistryEvent(ServiceRegistry.RegistryEvent event) {
        switch (event.type()) {
            case REGISTERED -> initializeMetrics(event.instance());
            case DEREGISTERED -> {
                InstanceMetrics removed = metrics.remove(event.instance().getId());
                if (removed == null) {
                    return;
                }
                if (removed.getActiveConnections() > 0) {
                    draining.put(removed.getInstanceId(), removed);
                }
                log.debug("Instance metrics removed: id={}, activeConnections={}",
                        removed.getInstanceId(), removed.getActiveConnections());
            }
            default -> {
                // Health transitions do not affect metrics
            }
        }
    }

    private void initializeMetrics(ServiceInstance instance) {
        InstanceMetrics existing = metrics.get(instance.getId());
        if (existing != null) {
            existing.setWeight(instance.getWeight());
            log.debug("Instance metrics kept on re-registration: id={}, activeConnections={}",
                    instance.getId(), existing.getActiveConnections());
            return;
        }

        InstanceMetrics entry = draining.remove(instance.getId());
        if (entry != null) {
            entry.setWeight(instance.getWeight());
        } else {
            entry = new InstanceMetrics(instance.getId(), instance.getWeight());
        }
        metrics.put(instance.getId(), entry);
        for (Consumer<InstanceMetrics> listener : metricsListeners) {
            try {
                listener.accept(entry);
            } catch (Exception e) {
                log.error("Error notifying metrics listener: id={}", instance.getId(), e);
            }
        }
    }

    public record LoadBalancerStats(
            String strategy,
            int totalServices,
            long totalRequests,
            double averageResponseTime,
            List<InstanceMetrics.Snapshot> instances
    ) {
    }
}
