package fr.lapetina.gateway.infrastructure.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable circuit breaker settings, validated at construction.
 *
 * @param failureThreshold  consecutive CLOSED failures that open the circuit
 * @param recoveryTimeout   time spent OPEN before a probe call is let through
 * @param successThreshold  HALF_OPEN successes required to close again
 * @param timeout           per-call timeout; slower calls count as failures
 * @param monitoringPeriod  observation window reported with the settings; failures are
 *                          counted until a success regardless of their spacing
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        int successThreshold,
        Duration timeout,
        Duration monitoringPeriod
) {
    public CircuitBreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(monitoringPeriod, "monitoringPeriod");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive: " + successThreshold);
        }
        if (recoveryTimeout.isNegative() || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout and timeout must be positive");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 3, Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    public CircuitBreakerConfig withFailureThreshold(int value) {
        return new CircuitBreakerConfig(value, recoveryTimeout, successThreshold, timeout, monitoringPeriod);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration value) {
        return new CircuitBreakerConfig(failureThreshold, value, successThreshold, timeout, monitoringPeriod);
    }

    public CircuitBreakerConfig withSuccessThreshold(int value) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, value, timeout, monitoringPeriod);
    }

    public CircuitBreakerConfig withTimeout(Duration value) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, value, monitoringPeriod);
    }

    public CircuitBreakerConfig withMonitoringPeriod(Duration value) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, timeout, value);
    }
}
