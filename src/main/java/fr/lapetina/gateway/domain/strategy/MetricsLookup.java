package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.InstanceMetrics;

import java.util.Optional;

/**
 * Read access to per-instance metrics for strategies.
 */
@FunctionalInterface
public interface MetricsLookup {

    Optional<InstanceMetrics> find(String instanceId);

    static MetricsLookup empty() {
        return instanceId -> Optional.empty();
    }
}
