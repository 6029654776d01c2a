package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random selection.
 *
 * Uses ThreadLocalRandom for thread-safe, contention-free random numbers.
 */
public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(ThreadLocalRandom.current().nextInt(candidates.size())));
    }
}
