package fr.lapetina.gateway.infrastructure.discovery;

import fr.lapetina.gateway.domain.model.InstanceStatus;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * In-memory registry of service instances, keyed by service name.
 *
 * Each name maps to an immutable, ordered instance list that is replaced
 * atomically per name, so readers never observe a partial update and
 * lookups stay O(1) per name.
 */
public final class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, List<ServiceInstance>> services = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers an instance, replacing any instance with the same id under
     * the same name in place. New instances start with status UNKNOWN.
     */
    public void register(ServiceInstance instance) {
        services.compute(instance.getName(), (name, current) -> {
            List<ServiceInstance> updated = new ArrayList<>(current != null ? current : List.of());
            int existing = indexOf(updated, instance.getId());
            if (existing >= 0) {
                updated.set(existing, instance);
            } else {
                updated.add(instance);
            }
            return List.copyOf(updated);
        });
        log.info("Service registered: name={}, id={}, address={}:{}",
                instance.getName(), instance.getId(), instance.getHost(), instance.getPort());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REGISTERED, instance));
    }

    /**
     * Removes an instance. Emits DEREGISTERED only when something was removed.
     */
    public Optional<ServiceInstance> deregister(String serviceName, String instanceId) {
        ServiceInstance[] removed = new ServiceInstance[1];
        services.computeIfPresent(serviceName, (name, current) -> {
            int index = indexOf(current, instanceId);
            if (index < 0) {
                return current;
            }
            removed[0] = current.get(index);
            List<ServiceInstance> updated = new ArrayList<>(current);
            updated.remove(index);
            return updated.isEmpty() ? null : List.copyOf(updated);
        });

        if (removed[0] == null) {
            log.debug("Deregister ignored, instance not found: name={}, id={}", serviceName, instanceId);
            return Optional.empty();
        }
        log.info("Service deregistered: name={}, id={}", serviceName, instanceId);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.DEREGISTERED, removed[0]));
        return Optional.of(removed[0]);
    }

    /**
     * Returns healthy instances whose tags contain all requested tags.
     * Unknown names yield an empty list.
     */
    public List<ServiceInstance> discover(String serviceName, Set<String> tags) {
        List<ServiceInstance> instances = services.getOrDefault(serviceName, List.of());
        return instances.stream()
                .filter(ServiceInstance::isHealthy)
                .filter(instance -> instance.hasAllTags(tags))
                .toList();
    }

    public List<ServiceInstance> discover(String serviceName) {
        return discover(serviceName, Set.of());
    }

    /**
     * Uniform random choice among {@link #discover} results.
     */
    public Optional<ServiceInstance> pickOne(String serviceName, Set<String> tags) {
        List<ServiceInstance> candidates = discover(serviceName, tags);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(ThreadLocalRandom.current().nextInt(candidates.size())));
    }

    /**
     * All instances for a name regardless of status.
     */
    public List<ServiceInstance> getInstances(String serviceName) {
        return services.getOrDefault(serviceName, List.of());
    }

    public Optional<ServiceInstance> getInstance(String serviceName, String instanceId) {
        return getInstances(serviceName).stream()
                .filter(instance -> instance.getId().equals(instanceId))
                .findFirst();
    }

    public List<ServiceInstance> getAllInstances() {
        return services.values().stream()
                .flatMap(Collection::stream)
                .toList();
    }

    /**
     * Snapshot of every service name and its instances, sorted by name.
     */
    public Map<String, List<ServiceInstance>> getAllServices() {
        Map<String, List<ServiceInstance>> snapshot = new LinkedHashMap<>();
        services.keySet().stream().sorted().forEach(name -> {
            List<ServiceInstance> instances = services.get(name);
            if (instances != null) {
                snapshot.put(name, instances);
            }
        });
        return snapshot;
    }

    /**
     * Applies a health-check outcome. RECOVERED is emitted when an instance
     * becomes healthy, UNHEALTHY when a healthy instance stops being healthy.
     */
    public void updateStatus(ServiceInstance instance, InstanceStatus status) {
        InstanceStatus previous = instance.updateStatus(status);
        if (previous == status) {
            return;
        }
        log.info("Service status changed: name={}, id={}, {} -> {}",
                instance.getName(), instance.getId(), previous, status);
        if (status == InstanceStatus.HEALTHY) {
            notifyListeners(new RegistryEvent(RegistryEvent.Type.RECOVERED, instance));
        } else if (previous == InstanceStatus.HEALTHY) {
            notifyListeners(new RegistryEvent(RegistryEvent.Type.UNHEALTHY, instance));
        }
    }

    /**
     * For each dependency declared by the service's first instance, whether
     * at least one healthy instance exists.
     */
    public Map<String, Boolean> checkDependencies(String serviceName) {
        List<ServiceInstance> instances = getInstances(serviceName);
        if (instances.isEmpty()) {
            return Map.of();
        }
        return checkDependencies(instances.get(0).getDependencies());
    }

    public Map<String, Boolean> checkDependencies(List<String> dependencies) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String dependency : dependencies) {
            result.put(dependency, !discover(dependency).isEmpty());
        }
        return result;
    }

    public ServiceHealth getServiceHealth(String serviceName) {
        List<ServiceInstance> instances = getInstances(serviceName);
        int healthy = (int) instances.stream().filter(ServiceInstance::isHealthy).count();
        return new ServiceHealth(serviceName, healthy, instances.size() - healthy, instances.size());
    }

    public RegistryStats getStats() {
        List<ServiceInstance> all = getAllInstances();
        int healthy = (int) all.stream().filter(ServiceInstance::isHealthy).count();
        return new RegistryStats(services.size(), all.size(), healthy);
    }

    public int size() {
        return services.values().stream().mapToInt(List::size).sum();
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: event={}", event.type(), e);
            }
        }
    }

    private static int indexOf(List<ServiceInstance> instances, String instanceId) {
        for (int i = 0; i < instances.size(); i++) {
            if (instances.get(i).getId().equals(instanceId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, ServiceInstance instance) {
        public enum Type {
            REGISTERED,
            DEREGISTERED,
            RECOVERED,
            UNHEALTHY
        }
    }

    public record ServiceHealth(String serviceName, int healthy, int unhealthy, int total) {
    }

    public record RegistryStats(int totalServices, int totalInstances, int healthyInstances) {
    }
}
