package fr.lapetina.gateway.infrastructure.http;

import java.time.Instant;

/**
 * Point-in-time snapshot of a circuit breaker.
 */
public record CircuitBreakerStats(
        String name,
        CircuitBreaker.State state,
        int failureCount,
        int successCount,
        long totalRequests,
        long totalFailures,
        long totalSuccesses,
        Instant lastFailureTime,
        Instant lastSuccessTime,
        Instant nextAttemptTime
) {
}
