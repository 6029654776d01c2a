package fr.lapetina.gateway.domain.event;

import fr.lapetina.gateway.domain.model.ErrorType;

import java.time.Instant;

/**
 * Outcome of one routed gateway request, published to gateway listeners.
 *
 * @param instanceId selected instance, null when none was selected
 * @param errorType  null on success
 */
public record RequestRecord(
        String requestId,
        String method,
        String path,
        String serviceName,
        String instanceId,
        int statusCode,
        long responseTimeMs,
        ErrorType errorType,
        Instant timestamp
) {
    public boolean isSuccess() {
        return errorType == null && statusCode < 400;
    }
}
