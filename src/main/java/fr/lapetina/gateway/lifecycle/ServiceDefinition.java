package fr.lapetina.gateway.lifecycle;

import fr.lapetina.gateway.domain.model.Protocol;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of a service the {@link ServiceManager} starts and stops.
 * A service tagged {@value #CRITICAL_TAG} aborts a bulk start when it fails.
 */
public final class ServiceDefinition {

    public static final String CRITICAL_TAG = "critical";

    private final String name;
    private final String version;
    private final String host;
    private final int port;
    private final Protocol protocol;
    private final String healthEndpoint;
    private final Set<String> tags;
    private final List<String> dependencies;
    private final Map<String, Object> metadata;
    private final List<RouteConfig> routes;
    private final Duration startupTimeout;
    private final Duration shutdownTimeout;

    private ServiceDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Service name is required");
        this.version = builder.version;
        this.host = builder.host;
        this.port = builder.port;
        this.protocol = builder.protocol;
        this.healthEndpoint = builder.healthEndpoint;
        this.tags = Set.copyOf(builder.tags);
        this.dependencies = List.copyOf(builder.dependencies);
        this.metadata = Map.copyOf(builder.metadata);
        this.routes = builder.routes.stream().map(route -> route.withServiceName(builder.name)).toList();
        this.startupTimeout = builder.startupTimeout;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    /**
     * Instance to register with the registry when the service starts.
     */
    public ServiceInstance toInstance(String instanceId) {
        return ServiceInstance.builder()
                .id(instanceId)
                .name(name)
                .version(version)
                .host(host)
                .port(port)
                .protocol(protocol)
                .healthEndpoint(healthEndpoint)
                .tags(tags)
                .dependencies(dependencies)
                .metadata(metadata)
                .build();
    }

    public boolean isCritical() {
        return tags.contains(CRITICAL_TAG);
    }

    public String getName() { return name; }

    public String getVersion() { return version; }

    public String getHost() { return host; }

    public int getPort() { return port; }

    public Protocol getProtocol() { return protocol; }

    public String getHealthEndpoint() { return healthEndpoint; }

    public Set<String> getTags() { return tags; }

    public List<String> getDependencies() { return dependencies; }

    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Routes bound to this service.
     */
    public List<RouteConfig> getRoutes() { return routes; }

    public Duration getStartupTimeout() { return startupTimeout; }

    public Duration getShutdownTimeout() { return shutdownTimeout; }

    @Override
    public String toString() {
        return "ServiceDefinition{" + name + "@" + host + ":" + port + ", dependencies=" + dependencies + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String version = "1.0.0";
        private String host = "localhost";
        private int port;
        private Protocol protocol = Protocol.HTTP;
        private String healthEndpoint = "/health";
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<String> dependencies = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<RouteConfig> routes = new ArrayList<>();
        private Duration startupTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

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
            this.tags.addAll(tags);
            return this;
        }

        public Builder dependsOn(String... names) {
            this.dependencies.addAll(List.of(names));
            return this;
        }

        public Builder dependencies(List<String> names) {
            this.dependencies.addAll(names);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder addRoute(RouteConfig route) {
            this.routes.add(route);
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ServiceDefinition build() {
            return new ServiceDefinition(this);
        }
    }
}
