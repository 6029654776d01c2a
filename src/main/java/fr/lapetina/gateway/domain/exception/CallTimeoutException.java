package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

import java.time.Duration;

/**
 * Thrown when a breaker-wrapped call exceeds its per-call timeout.
 */
public final class CallTimeoutException extends GatewayException {

    private final Duration timeout;

    public CallTimeoutException(String breakerName, Duration timeout) {
        super(ErrorType.TIMEOUT, "Call timed out after " + timeout.toMillis() + "ms: " + breakerName);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
