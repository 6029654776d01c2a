package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.domain.exception.GatewayException;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyResponse;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps gateway failures to HTTP responses.
 *
 * Upstream and internal failure details stay in the logs; callers only
 * see a generic message for them.
 */
public final class GatewayErrors {

    private GatewayErrors() {
        // Utility class
    }

    public static int statusFor(ErrorType errorType) {
        return switch (errorType) {
            case NO_ROUTE -> 404;
            case CIRCUIT_OPEN, NO_AVAILABLE_INSTANCE, BACKPRESSURE -> 503;
            case TIMEOUT -> 504;
            case RATE_LIMITED -> 429;
            case QUEUE_TIMEOUT -> 408;
            case UPSTREAM_ERROR, CONFIGURATION_ERROR, INTERNAL_ERROR -> 500;
        };
    }

    public static ErrorType classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof GatewayException gatewayException) {
            return gatewayException.getErrorType();
        }
        if (cause instanceof HttpTimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorType.UPSTREAM_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    public static ProxyResponse toResponse(ErrorType errorType, String message, String requestId,
                                           String instanceId, long responseTimeMs) {
        return ProxyResponse.error(statusFor(errorType), errorType, message, requestId, instanceId, responseTimeMs);
    }

    public static ProxyResponse toResponse(Throwable error, String requestId, String instanceId, long responseTimeMs) {
        ErrorType errorType = classify(error);
        return toResponse(errorType, publicMessage(errorType, unwrap(error)), requestId, instanceId, responseTimeMs);
    }

    static String publicMessage(ErrorType errorType, Throwable cause) {
        return switch (errorType) {
            case CIRCUIT_OPEN -> "Service temporarily unavailable";
            case NO_AVAILABLE_INSTANCE -> "Service Unavailable";
            case BACKPRESSURE -> "Gateway overloaded";
            case TIMEOUT -> "Gateway Timeout";
            case RATE_LIMITED, QUEUE_TIMEOUT -> cause.getMessage();
            case NO_ROUTE -> "Not Found";
            case UPSTREAM_ERROR, CONFIGURATION_ERROR, INTERNAL_ERROR -> "Internal Server Error";
        };
    }

    /**
     * Strips the wrappers added by CompletableFuture composition.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
