package fr.lapetina.gateway.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Request about to be sent to a selected instance. Route request
 * transforms receive and return this type.
 */
public record OutboundRequest(
        String requestId,
        String method,
        String path,
        Map<String, String> headers,
        Map<String, List<String>> query,
        Object body
) {
    public OutboundRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        query = query == null ? Map.of() : query.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    public OutboundRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new OutboundRequest(requestId, method, path, copy, query, body);
    }

    public OutboundRequest withPath(String newPath) {
        return new OutboundRequest(requestId, method, newPath, headers, query, body);
    }

    public OutboundRequest withBody(Object newBody) {
        return new OutboundRequest(requestId, method, path, headers, query, newBody);
    }
}
