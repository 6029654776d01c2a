package fr.lapetina.gateway.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable inbound request as seen by the gateway.
 *
 * @param method        HTTP method, upper case
 * @param path          request path without query string
 * @param headers       headers with lower-cased names
 * @param query         decoded query parameters; repeated names keep every value in order
 * @param body          parsed JSON node, raw text, or null when empty
 * @param clientAddress remote address used as the default rate limit key
 */
public record ProxyRequest(
        String method,
        String path,
        Map<String, String> headers,
        Map<String, List<String>> query,
        Object body,
        String clientAddress
) {
    public ProxyRequest {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(path, "path is required");
        method = method.toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : headers.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (first, second) -> first));
        query = query == null ? Map.of() : query.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
        clientAddress = clientAddress == null || clientAddress.isBlank() ? "unknown" : clientAddress;
    }

    public static ProxyRequest of(String method, String path) {
        return new ProxyRequest(method, path, Map.of(), Map.of(), null, null);
    }

    /**
     * First value of a query parameter, or null.
     */
    public String queryParam(String name) {
        List<String> values = query.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
