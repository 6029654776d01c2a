package fr.lapetina.gateway.lifecycle;

import fr.lapetina.gateway.domain.model.HealthStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a managed service's runtime status.
 *
 * @param health       latest health check outcome, null before the first check
 * @param dependencies per dependency, whether it had a healthy instance at the last start
 * @param instanceId   instance registered by the last start, null when none
 */
public record ServiceStatus(
        String name,
        LifecycleState state,
        HealthStatus health,
        Instant startedAt,
        Instant stoppedAt,
        String error,
        Map<String, Boolean> dependencies,
        String instanceId
) {
    public ServiceStatus {
        dependencies = dependencies == null ? Map.of() : Map.copyOf(dependencies);
    }
}
