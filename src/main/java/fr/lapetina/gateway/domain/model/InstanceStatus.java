package fr.lapetina.gateway.domain.model;

/**
 * Registry-level status of a service instance.
 */
public enum InstanceStatus {
    /** Last health probe succeeded; eligible for selection */
    HEALTHY,

    /** Last health probe failed */
    UNHEALTHY,

    /** Registered but not yet probed */
    UNKNOWN
}
