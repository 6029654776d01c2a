package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

import java.time.Instant;

/**
 * Thrown when a call is short-circuited by an open breaker.
 * The wrapped operation was not invoked.
 */
public final class CircuitOpenException extends GatewayException {

    private final String breakerName;
    private final Instant nextAttemptTime;

    public CircuitOpenException(String breakerName, Instant nextAttemptTime) {
        super(ErrorType.CIRCUIT_OPEN, "Circuit breaker is OPEN for service: " + breakerName);
        this.breakerName = breakerName;
        this.nextAttemptTime = nextAttemptTime;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Instant getNextAttemptTime() {
        return nextAttemptTime;
    }
}
