package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Least-connections load balancing strategy.
 *
 * Selects the instance with the fewest active connections; ties go to the
 * earliest instance in registry order. Instances without metrics count as idle.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least-connections";
    }

    @Override
    public Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        ServiceInstance selected = null;
        int minConnections = Integer.MAX_VALUE;

        for (ServiceInstance instance : candidates) {
            int connections = metrics.find(instance.getId())
                    .map(InstanceMetrics::getActiveConnections)
                    .orElse(0);
            if (connections < minConnections) {
                minConnections = connections;
                selected = instance;
            }
        }

        return Optional.ofNullable(selected);
    }
}
