package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Thrown when no healthy instance matches a service name and tags.
 */
public final class NoAvailableInstanceException extends GatewayException {

    private final String serviceName;

    public NoAvailableInstanceException(String serviceName) {
        super(ErrorType.NO_AVAILABLE_INSTANCE, "No healthy instances available for service: " + serviceName);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
