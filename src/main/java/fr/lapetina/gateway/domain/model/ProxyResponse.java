package fr.lapetina.gateway.domain.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable response returned to the gateway caller, either forwarded
 * from a downstream instance or produced by the gateway for a failure.
 *
 * @param statusCode     HTTP status to send
 * @param headers        response headers, hop-by-hop headers already removed
 * @param body           parsed JSON node, raw text, map (gateway errors) or null
 * @param responseTimeMs time spent in the downstream call
 * @param instanceId     instance that served the call, null when none was reached
 * @param errorType      failure category, null on success
 * @param routed         false when no route matched and the request is not the gateway's concern
 */
public record ProxyResponse(
        int statusCode,
        Map<String, String> headers,
        Object body,
        long responseTimeMs,
        String instanceId,
        ErrorType errorType,
        boolean routed
) {
    public ProxyResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ProxyResponse of(int statusCode, Map<String, String> headers, Object body,
                                   long responseTimeMs, String instanceId) {
        return new ProxyResponse(statusCode, headers, body, responseTimeMs, instanceId, null, true);
    }

    /**
     * Response for a request that matched no route.
     */
    public static ProxyResponse notRouted() {
        return new ProxyResponse(404, Map.of(), null, 0, null, ErrorType.NO_ROUTE, false);
    }

    /**
     * Gateway-generated error with body {@code {"error":{code,message,timestamp,requestId}}}.
     */
    public static ProxyResponse error(int statusCode, ErrorType errorType, String message,
                                      String requestId, String instanceId, long responseTimeMs) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", errorType.name());
        error.put("message", message);
        error.put("timestamp", Instant.now().toString());
        error.put("requestId", requestId);
        return new ProxyResponse(statusCode, Map.of(), Map.of("error", error),
                responseTimeMs, instanceId, errorType, true);
    }

    public boolean isSuccess() {
        return errorType == null && statusCode < 400;
    }

    public ProxyResponse withBody(Object newBody) {
        return new ProxyResponse(statusCode, headers, newBody, responseTimeMs, instanceId, errorType, routed);
    }

    public ProxyResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ProxyResponse(statusCode, copy, body, responseTimeMs, instanceId, errorType, routed);
    }
}
