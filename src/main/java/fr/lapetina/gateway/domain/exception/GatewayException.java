package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Base class for failures that carry an {@link ErrorType}.
 */
public abstract class GatewayException extends RuntimeException {

    private final ErrorType errorType;

    protected GatewayException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected GatewayException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
