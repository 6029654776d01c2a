package fr.lapetina.gateway.lifecycle;

/**
 * Thrown when a managed service cannot be started or stopped.
 */
public class ServiceLifecycleException extends RuntimeException {

    private final String serviceName;

    public ServiceLifecycleException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public ServiceLifecycleException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
