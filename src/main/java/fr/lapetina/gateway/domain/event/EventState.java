package fr.lapetina.gateway.domain.event;

/**
 * Lifecycle state of a gateway request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting route lookup */
    CREATED,

    /** A route matched the request */
    ROUTED,

    /** No route matched; the request is not the gateway's concern */
    NO_ROUTE,

    /** Admission requested from the rate limiter */
    ADMISSION_PENDING,

    /** Handed to the proxy; completion happens asynchronously */
    DISPATCHED,

    /** Failed inside the pipeline before dispatch */
    FAILED
}
