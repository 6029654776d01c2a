package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.domain.model.OutboundRequest;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.RouteConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the request sent downstream and issues request ids.
 *
 * Only allow-listed inbound headers are forwarded; the gateway adds its own
 * identification headers.
 */
public final class OutboundRequestFactory {

    public static final Set<String> FORWARDED_HEADERS = Set.of(
            "content-type",
            "authorization",
            "accept",
            "user-agent",
            "accept-language"
    );

    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String FORWARDED_BY_HEADER = "x-forwarded-by";
    public static final String GATEWAY_VERSION_HEADER = "x-gateway-version";

    private final String gatewayName;
    private final String gatewayVersion;
    private final AtomicLong requestCounter = new AtomicLong();

    public OutboundRequestFactory(String gatewayName, String gatewayVersion) {
        this.gatewayName = gatewayName;
        this.gatewayVersion = gatewayVersion;
    }

    public OutboundRequestFactory() {
        this("resilient-gateway", "1.0.0");
    }

    /**
     * Returns a new id of the form {@code req_<epochMillis>_<counter>}.
     */
    public String nextRequestId() {
        return "req_" + System.currentTimeMillis() + "_" + requestCounter.incrementAndGet();
    }

    public OutboundRequest create(ProxyRequest request, RouteConfig route, String requestId) {
        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().forEach((name, value) -> {
            if (FORWARDED_HEADERS.contains(name)) {
                headers.put(name, value);
            }
        });
        headers.put(REQUEST_ID_HEADER, requestId);
        headers.put(FORWARDED_BY_HEADER, gatewayName);
        headers.put(GATEWAY_VERSION_HEADER, gatewayVersion);

        return new OutboundRequest(
                requestId,
                request.method(),
                route.getTargetPath(),
                headers,
                request.query(),
                request.body()
        );
    }
}
