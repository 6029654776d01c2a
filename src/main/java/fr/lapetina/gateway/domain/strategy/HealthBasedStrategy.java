package fr.lapetina.gateway.domain.strategy;

import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Picks the instance with the best health score.
 *
 * Score = 0.4 * latency score + 0.4 * (1 - error rate) + 0.2 * load score,
 * see {@link InstanceMetrics#healthScore()}. Instances without metrics score
 * {@value #UNKNOWN_SCORE}. Ties go to the first instance seen.
 */
public final class HealthBasedStrategy implements LoadBalancingStrategy {

    static final double UNKNOWN_SCORE = 0.5;

    @Override
    public String getName() {
        return "health-based";
    }

    @Override
    public Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> candidates, MetricsLookup metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        ServiceInstance best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (ServiceInstance instance : candidates) {
            double score = metrics.find(instance.getId())
                    .map(InstanceMetrics::healthScore)
                    .orElse(UNKNOWN_SCORE);
            if (score > bestScore) {
                bestScore = score;
                best = instance;
            }
        }

        return Optional.ofNullable(best);
    }
}
