package fr.lapetina.gateway.domain.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Gateway route: binds an inbound {@code (method, path)} to a backend service.
 * Immutable; replace it through the gateway to change it.
 */
public final class RouteConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String method;
    private final String path;
    private final String serviceName;
    private final String targetPath;
    private final Set<String> tags;
    private final Duration timeout;
    private final RateLimitRule rateLimit;
    private final UnaryOperator<OutboundRequest> requestTransform;
    private final UnaryOperator<ProxyResponse> responseTransform;

    private RouteConfig(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "Route method is required").toUpperCase(Locale.ROOT);
        this.path = Objects.requireNonNull(builder.path, "Route path is required");
        this.serviceName = Objects.requireNonNull(builder.serviceName, "Route service name is required");
        this.targetPath = builder.targetPath != null ? builder.targetPath : builder.path;
        this.tags = builder.tags != null ? Set.copyOf(builder.tags) : Set.of();
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.rateLimit = builder.rateLimit;
        this.requestTransform = builder.requestTransform;
        this.responseTransform = builder.responseTransform;
    }

    /**
     * Route table key, {@code METHOD:path}.
     */
    public String key() {
        return key(method, path);
    }

    public static String key(String method, String path) {
        return method.toUpperCase(Locale.ROOT) + ":" + path;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Optional<RateLimitRule> getRateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    public OutboundRequest transformRequest(OutboundRequest request) {
        return requestTransform != null ? requestTransform.apply(request) : request;
    }

    public ProxyResponse transformResponse(ProxyResponse response) {
        return responseTransform != null ? responseTransform.apply(response) : response;
    }

    public boolean hasTransforms() {
        return requestTransform != null || responseTransform != null;
    }

    /**
     * Copy of this route bound to another service.
     */
    public RouteConfig withServiceName(String newServiceName) {
        return builder()
                .method(method)
                .path(path)
                .serviceName(newServiceName)
                .targetPath(targetPath)
                .tags(tags)
                .timeout(timeout)
                .rateLimit(rateLimit)
                .requestTransform(requestTransform)
                .responseTransform(responseTransform)
                .build();
    }

    @Override
    public String toString() {
        return "RouteConfig{" + key() + " -> " + serviceName + targetPath + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method;
        private String path;
        private String serviceName;
        private String targetPath;
        private Set<String> tags;
        private Duration timeout;
        private RateLimitRule rateLimit;
        private UnaryOperator<OutboundRequest> requestTransform;
        private UnaryOperator<ProxyResponse> responseTransform;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder targetPath(String targetPath) {
            this.targetPath = targetPath;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder rateLimit(RateLimitRule rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder requestTransform(UnaryOperator<OutboundRequest> transform) {
            this.requestTransform = transform;
            return this;
        }

        public Builder responseTransform(UnaryOperator<ProxyResponse> transform) {
            this.responseTransform = transform;
            return this;
        }

        public RouteConfig build() {
            return new RouteConfig(this);
        }
    }
}
