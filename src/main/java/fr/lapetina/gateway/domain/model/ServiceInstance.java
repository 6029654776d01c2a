package fr.lapetina.gateway.domain.model;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One running backend process registered under a service name.
 * Identity and addressing are immutable; status is updated by health checks.
 */
public final class ServiceInstance {

    private final String id;
    private final String name;
    private final String version;
    private final String host;
    private final int port;
    private final Protocol protocol;
    private final String healthEndpoint;
    private final Set<String> tags;
    private final List<String> dependencies;
    private final Map<String, Object> metadata;
    private final Instant registeredAt;

    // Mutable state - thread-safe
    private final AtomicReference<InstanceStatus> status;
    private volatile Instant lastHealthCheck;

    private ServiceInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Instance ID is required");
        this.name = Objects.requireNonNull(builder.name, "Service name is required");
        this.host = Objects.requireNonNull(builder.host, "Host is required");
        if (builder.port <= 0 || builder.port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + builder.port);
        }
        this.version = builder.version;
        this.port = builder.port;
        this.protocol = builder.protocol;
        this.healthEndpoint = normalizePath(builder.healthEndpoint);
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.dependencies = List.copyOf(builder.dependencies);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.registeredAt = Instant.now();
        this.status = new AtomicReference<>(InstanceStatus.UNKNOWN);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public String getHealthEndpoint() {
        return healthEndpoint;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean hasAllTags(Set<String> required) {
        return required == null || tags.containsAll(required);
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Load-balancing weight taken from {@code metadata.weight}, defaulting to 1.
     */
    public int getWeight() {
        Object raw = metadata.get("weight");
        if (raw instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (raw instanceof String text) {
            try {
                return Math.max(0, Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return 1;
            }
        }
        return 1;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public InstanceStatus getStatus() {
        return status.get();
    }

    /**
     * Sets the status and returns the previous one.
     */
    public InstanceStatus updateStatus(InstanceStatus newStatus) {
        lastHealthCheck = Instant.now();
        return status.getAndSet(newStatus);
    }

    public boolean isHealthy() {
        return status.get() == InstanceStatus.HEALTHY;
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    /**
     * Base URI for HTTP traffic, e.g. {@code http://host:port}.
     */
    public URI getBaseUri() {
        return URI.create(protocol.httpScheme() + "://" + host + ":" + port);
    }

    public URI getHealthUri() {
        return URI.create(getBaseUri() + healthEndpoint);
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return "/health";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceInstance that = (ServiceInstance) o;
        return id.equals(that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "ServiceInstance{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", address=" + host + ":" + port +
                ", status=" + status.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String version = "1.0.0";
        private String host;
        private int port;
        private Protocol protocol = Protocol.HTTP;
        private String healthEndpoint = "/health";
        private final Set<String> tags = new LinkedHashSet<>();
        private List<String> dependencies = List.of();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder healthEndpoint(String healthEndpoint) {
            this.healthEndpoint = healthEndpoint;
            return this;
        }

        public Builder addTag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? dependencies : List.of();
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder weight(int weight) {
            this.metadata.put("weight", weight);
            return this;
        }

        public ServiceInstance build() {
            return new ServiceInstance(this);
        }
    }
}
