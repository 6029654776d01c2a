package fr.lapetina.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of a single health probe.
 *
 * DEGRADED instances still answer and are kept in rotation; only
 * UNHEALTHY removes an instance from selection.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public InstanceStatus toInstanceStatus() {
        return this == UNHEALTHY ? InstanceStatus.UNHEALTHY : InstanceStatus.HEALTHY;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a status reported by an instance health endpoint.
     */
    public static Optional<HealthStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "healthy", "ok", "up" -> Optional.of(HEALTHY);
            case "degraded" -> Optional.of(DEGRADED);
            case "unhealthy", "down" -> Optional.of(UNHEALTHY);
            default -> Optional.empty();
        };
    }
}
