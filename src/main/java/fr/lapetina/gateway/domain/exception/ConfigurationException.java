package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Fatal configuration error: invalid settings, unknown service or
 * dependency cycle. Never retried.
 */
public final class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION_ERROR, message, cause);
    }
}
