package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Thrown when the rate limiter refuses a request.
 */
public final class RateLimitExceededException extends GatewayException {

    private final Reason reason;
    private final String key;

    public RateLimitExceededException(Reason reason, String key) {
        super(reason.errorType, reason.message + ": key=" + key);
        this.reason = reason;
        this.key = key;
    }

    public Reason getReason() {
        return reason;
    }

    public String getKey() {
        return key;
    }

    public enum Reason {
        QUEUE_FULL("Rate limit exceeded, queue is full", ErrorType.RATE_LIMITED),
        QUEUE_TIMEOUT("Request timed out in rate limit queue", ErrorType.QUEUE_TIMEOUT);

        private final String message;
        private final ErrorType errorType;

        Reason(String message, ErrorType errorType) {
            this.message = message;
            this.errorType = errorType;
        }

        public String getMessage() {
            return message;
        }
    }
}
