package fr.lapetina.gateway.domain.exception;

import fr.lapetina.gateway.domain.model.ErrorType;

/**
 * Thrown when a downstream call answers with a server error status.
 * The downstream body is kept for logging only.
 */
public final class UpstreamException extends GatewayException {

    private final int statusCode;
    private final String responseBody;

    public UpstreamException(String target, int statusCode, String responseBody) {
        super(ErrorType.UPSTREAM_ERROR, "Upstream returned HTTP " + statusCode + ": " + target);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
