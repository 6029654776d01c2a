package fr.lapetina.gateway.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.gateway.domain.exception.UpstreamException;
import fr.lapetina.gateway.domain.model.OutboundRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * HTTP client for proxied calls and health probes against service instances.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Cancelling a returned
 * future aborts the underlying exchange. Server errors (5xx) fail the future
 * with {@link UpstreamException} so the surrounding circuit breaker counts them.
 */
public class GatewayHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayHttpClient.class);

    /** Connection-scoped headers that must not be forwarded. */
    public static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailers", "transfer-encoding", "upgrade"
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    public GatewayHttpClient(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public GatewayHttpClient() {
        this(Duration.ofSeconds(10));
    }

    /**
     * Sends a request to the instance.
     *
     * @param instance target instance
     * @param request  outbound request with allow-listed headers
     * @param timeout  request timeout applied by the HTTP client
     * @return future with the downstream response; fails on transport errors and 5xx
     */
    public CompletableFuture<ProxyResponse> send(ServiceInstance instance, OutboundRequest request, Duration timeout) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(instance, request, timeout);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: instanceId={}, requestId={}", instance.getId(), request.requestId(), e);
            return CompletableFuture.failedFuture(e);
        }

        long startNanos = System.nanoTime();
        log.debug("Sending request: instanceId={}, requestId={}, method={}, uri={}",
                instance.getId(), request.requestId(), request.method(), httpRequest.uri());

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        return abortOnCancel(exchange,
                exchange.thenApply(response -> handleResponse(instance, request, response, startNanos)));
    }

    /**
     * Cancelling the returned future aborts the underlying exchange.
     */
    private static <T> CompletableFuture<T> abortOnCancel(CompletableFuture<?> exchange, CompletableFuture<T> result) {
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private HttpRequest buildHttpRequest(ServiceInstance instance, OutboundRequest request, Duration timeout)
            throws JsonProcessingException {
        URI uri = buildUri(instance, request.path(), request.query());

        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(serializeBody(request.body()));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .method(request.method(), publisher);

        request.headers().forEach(builder::header);
        if (request.body() != null && !request.headers().containsKey("content-type")) {
            builder.header("content-type", "application/json");
        }
        return builder.build();
    }

    static URI buildUri(ServiceInstance instance, String path, Map<String, List<String>> query) {
        StringBuilder uri = new StringBuilder(instance.getBaseUri().toString());
        uri.append(path.startsWith("/") ? path : "/" + path);
        if (!query.isEmpty()) {
            uri.append('?').append(query.entrySet().stream()
                    .flatMap(e -> e.getValue().stream()
                            .map(value -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                                    + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)))
                    .collect(Collectors.joining("&")));
        }
        return URI.create(uri.toString());
    }

    private ProxyResponse handleResponse(
            ServiceInstance instance,
            OutboundRequest request,
            HttpResponse<String> response,
            long startNanos
    ) {
        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        int statusCode = response.statusCode();

        if (statusCode >= 500) {
            log.warn("Request failed with HTTP error: instanceId={}, requestId={}, status={}, latencyMs={}",
                    instance.getId(), request.requestId(), statusCode, latencyMs);
            throw new UpstreamException(instance.getId(), statusCode, response.body());
        }

        log.debug("Response received: instanceId={}, requestId={}, status={}, latencyMs={}",
                instance.getId(), request.requestId(), statusCode, latencyMs);

        return ProxyResponse.of(statusCode, filterHeaders(response.headers()),
                parseBody(response.body()), latencyMs, instance.getId());
    }

    /**
     * Drops hop-by-hop and length headers; the inbound server recomputes length.
     */
    static Map<String, String> filterHeaders(HttpHeaders headers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(name) || name.equals("content-length") || name.startsWith(":")) {
                continue;
            }
            result.put(name, String.join(", ", entry.getValue()));
        }
        return result;
    }

    /**
     * Probes an instance health endpoint.
     *
     * @return future with the status code and parsed body; fails on
     *         transport errors and non-2xx statuses
     */
    public CompletableFuture<HealthProbeResponse> probe(ServiceInstance instance, Duration timeout) {
        URI uri = instance.getHealthUri();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("accept", "application/json")
                .GET()
                .build();

        long startNanos = System.nanoTime();
        log.debug("Health probe started: instanceId={}, uri={}", instance.getId(), uri);

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        return abortOnCancel(exchange, exchange.thenApply(response -> {
                    long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        throw new UpstreamException(instance.getId(), status, response.body());
                    }
                    Object body = parseBody(response.body());
                    JsonNode json = body instanceof JsonNode node ? node : null;
                    return new HealthProbeResponse(status, json, latencyMs);
                }));
    }

    /**
     * Parses a body as JSON, falling back to the raw text.
     */
    public Object parseBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() ? body : node;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    public String serializeBody(Object body) throws JsonProcessingException {
        if (body instanceof String text) {
            return text;
        }
        return objectMapper.writeValueAsString(body);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21
        log.debug("Gateway HTTP client closed");
    }

    /**
     * Successful health endpoint answer.
     *
     * @param body parsed JSON body, or null when absent or not JSON
     */
    public record HealthProbeResponse(int statusCode, JsonNode body, long responseTimeMs) {
    }
}
