package fr.lapetina.gateway.lifecycle;

/**
 * Event emitted by the {@link ServiceManager}.
 *
 * @param serviceName null for the ALL_* events
 * @param error       set for FAILED only
 */
public record LifecycleEvent(Type type, String serviceName, Throwable error) {

    public enum Type {
        REGISTERED,
        STARTING,
        STARTED,
        FAILED,
        STOPPING,
        STOPPED,
        ALL_STARTED,
        ALL_STOPPED
    }

    static LifecycleEvent of(Type type, String serviceName) {
        return new LifecycleEvent(type, serviceName, null);
    }
}
