package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Weighted round-robin load balancing strategy.
 *
 * A per-service counter modulo the total weight lands in one instance's
 * weight band: an instance with weight 2 receives twice as many requests as
 * one with weight 1. Total weight is recomputed on every call so weight
 * changes apply immediately.
 */
public final class WeightedRoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "weighted-round-robin";
    }

    @Override
    public Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int[] weights = new int[candidates.size()];
        int totalWeight = 0;
        for (int i = 0; i < candidates.size(); i++) {
            ServiceInstance instance = candidates.get(i);
            weights[i] = metrics.find(instance.getId())
                    .map(InstanceMetrics::getWeight)
                    .orElse(instance.getWeight());
            totalWeight += weights[i];
        }

        if (totalWeight <= 0) {
            return Optional.of(candidates.get(0));
        }

        AtomicInteger counter = counters.computeIfAbsent(serviceName, name -> new AtomicInteger(0));
        int position = Math.floorMod(counter.getAndIncrement(), totalWeight);

        for (int i = 0; i < candidates.size(); i++) {
            position -= weights[i];
            if (position < 0) {
                return Optional.of(candidates.get(i));
            }
        }
        return Optional.of(candidates.get(0));
    }

    @Override
    public void reset() {
        counters.clear();
    }
}
