package fr.lapetina.gateway.domain.model;

/**
 * Error taxonomy for gateway requests and control-plane operations.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** No route registered for the inbound method and path */
    NO_ROUTE,

    /** No healthy instance matched the route's service name and tags */
    NO_AVAILABLE_INSTANCE,

    /** Circuit breaker is open for the target */
    CIRCUIT_OPEN,

    /** Wrapped call exceeded its per-call timeout */
    TIMEOUT,

    /** Rate limit window exhausted and overflow queue full */
    RATE_LIMITED,

    /** Request waited in the rate limit queue longer than allowed */
    QUEUE_TIMEOUT,

    /** Downstream answered with a server error or the transport failed */
    UPSTREAM_ERROR,

    /** Request ring buffer is full */
    BACKPRESSURE,

    /** Invalid configuration, dependency cycle or unknown service */
    CONFIGURATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
