package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the candidate list with one counter per service name.
 *
 * Thread-safe via atomic counters.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        AtomicInteger counter = counters.computeIfAbsent(serviceName, name -> new AtomicInteger(0));
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public void reset() {
        counters.clear();
    }
}
