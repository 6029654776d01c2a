package fr.lapetina.gateway.lifecycle;

/**
 * Lifecycle state of a managed service.
 */
public enum LifecycleState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED
}
