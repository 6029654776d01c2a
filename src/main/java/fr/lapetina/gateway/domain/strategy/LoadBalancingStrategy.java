package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for picking one instance among healthy candidates.
 *
 * Implementations must be thread-safe as they are called from the gateway
 * pipeline and from completion callbacks concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects an instance.
     *
     * @param serviceName service the candidates belong to; keys per-service state
     * @param candidates  healthy, tag-matching instances in registry order
     * @param metrics     lookup for rolling per-instance metrics
     * @return selected instance, or empty if there are no candidates
     */
    Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics);

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
