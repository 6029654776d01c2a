package fr.lapetina.gateway.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one health probe against one instance.
 */
public record HealthCheckResult(
        String instanceId,
        String serviceName,
        HealthStatus status,
        long responseTimeMs,
        Map<String, Object> details,
        String error,
        Instant timestamp
) {
    public HealthCheckResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static HealthCheckResult failed(ServiceInstance instance, long responseTimeMs, String error) {
        return new HealthCheckResult(instance.getId(), instance.getName(), HealthStatus.UNHEALTHY,
                responseTimeMs, Map.of(), error, Instant.now());
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
