package fr.lapetina.gateway.infrastructure.balancer;

import fr.lapetina.gateway.domain.model.InstanceMetrics;
import fr.lapetina.gateway.domain.model.InstanceStatus;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.domain.strategy.LeastConnectionsStrategy;
import fr.lapetina.gateway.domain.strategy.RoundRobinStrategy;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LoadBalancerTest {

    private ServiceRegistry registry;
    private LoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        loadBalancer = new LoadBalancer(registry, new RoundRobinStrategy());
    }

    private ServiceInstance register(String id, InstanceStatus status, String... tags) {
        ServiceInstance instance = ServiceInstance.builder()
                .id(id)
                .name("api")
                .host("localhost")
                .port(8080)
                .tags(Set.of(tags))
                .build();
        registry.register(instance);
        registry.updateStatus(instance, status);
        return instance;
    }

    @Test
    @DisplayName("should select only healthy instances")
    void shouldSelectOnlyHealthyInstances() {
        register("api-1", InstanceStatus.UNHEALTHY);
        register("api-2", InstanceStatus.HEALTHY);

        for (int i = 0; i < 5; i++) {
            assertThat(loadBalancer.select("api")).map(ServiceInstance::getId).contains("api-2");
        }
    }

    @Test
    @DisplayName("should return empty when no instance matches")
    void shouldReturnEmptyWhenNothingMatches() {
        register("api-1", InstanceStatus.HEALTHY, "eu");

        assertThat(loadBalancer.select("api", Set.of("us"))).isEmpty();
        assertThat(loadBalancer.select("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should track metrics following registry events")
    void shouldTrackMetricsLifecycle() {
        List<InstanceMetrics> created = new ArrayList<>();
        loadBalancer.onMetricsCreated(created::add);

        register("api-1", InstanceStatus.HEALTHY);
        loadBalancer.recordRequest("api-1", 100, true);

        assertThat(created).extracting(InstanceMetrics::getInstanceId).containsExactly("api-1");
        assertThat(loadBalancer.getMetrics("api-1")).get()
                .extracting(InstanceMetrics::getTotalRequests).isEqualTo(1L);

        registry.deregister("api", "api-1");

        assertThat(loadBalancer.getMetrics("api-1")).isEmpty();
    }

    @Test
    @DisplayName("should smooth response time and error rate with a 0.1 moving average")
    void shouldSmoothMetricsWithMovingAverage() {
        register("api-1", InstanceStatus.HEALTHY);

        loadBalancer.recordRequest("api-1", 100, true);

        InstanceMetrics metrics = loadBalancer.getMetrics("api-1").orElseThrow();
        assertThat(metrics.getAverageResponseTime()).isCloseTo(10.0, within(1e-9));
        assertThat(metrics.getErrorRate()).isCloseTo(0.0, within(1e-9));

        loadBalancer.recordRequest("api-1", 200, false);

        // 0.1 * 200 + 0.9 * 10
        assertThat(metrics.getAverageResponseTime()).isCloseTo(29.0, within(1e-9));
        assertThat(metrics.getErrorRate()).isCloseTo(0.1, within(1e-9));

        loadBalancer.recordRequest("api-1", 0, true);

        assertThat(metrics.getErrorRate()).isCloseTo(0.09, within(1e-9));
        assertThat(metrics.getLastRequestTime()).isNotNull();
    }

    @Test
    @DisplayName("should never drop active connections below zero")
    void shouldFloorActiveConnectionsAtZero() {
        register("api-1", InstanceStatus.HEALTHY);

        loadBalancer.recordConnectionEnd("api-1");

        assertThat(loadBalancer.getActiveConnections("api-1")).isZero();

        loadBalancer.recordConnectionStart("api-1");
        loadBalancer.recordConnectionEnd("api-1");
        loadBalancer.recordConnectionEnd("api-1");

        assertThat(loadBalancer.getActiveConnections("api-1")).isZero();
        assertThat(loadBalancer.getMetrics("api-1")).get()
                .extracting(InstanceMetrics::getActiveConnections).isEqualTo(0);
    }

    @Test
    @DisplayName("should keep metrics and in-flight connections when an instance re-registers")
    void shouldKeepMetricsOnReRegistration() {
        register("api-1", InstanceStatus.HEALTHY);
        loadBalancer.recordConnectionStart("api-1");
        loadBalancer.recordConnectionStart("api-1");
        loadBalancer.recordRequest("api-1", 100, true);

        registry.register(ServiceInstance.builder()
                .id("api-1")
                .name("api")
                .host("localhost")
                .port(8080)
                .weight(3)
                .build());

        InstanceMetrics metrics = loadBalancer.getMetrics("api-1").orElseThrow();
        assertThat(metrics.getActiveConnections()).isEqualTo(2);
        assertThat(metrics.getTotalRequests()).isEqualTo(1);
        assertThat(metrics.getWeight()).isEqualTo(3);
    }

    @Test
    @DisplayName("should resume a draining instance that registers again")
    void shouldResumeDrainingInstance() {
        register("api-1", InstanceStatus.HEALTHY);
        loadBalancer.recordConnectionStart("api-1");
        registry.deregister("api", "api-1");

        register("api-1", InstanceStatus.HEALTHY);
        loadBalancer.recordConnectionEnd("api-1");

        assertThat(loadBalancer.getMetrics("api-1")).isPresent();
        assertThat(loadBalancer.getActiveConnections("api-1")).isZero();
    }

    @Test
    @DisplayName("should keep counting connections of an instance deregistered mid-call")
    void shouldDrainDeregisteredInstance() {
        register("api-1", InstanceStatus.HEALTHY);
        loadBalancer.recordConnectionStart("api-1");
        loadBalancer.recordConnectionStart("api-1");

        registry.deregister("api", "api-1");

        assertThat(loadBalancer.getActiveConnections("api-1")).isEqualTo(2);
        loadBalancer.recordConnectionEnd("api-1");
        assertThat(loadBalancer.getActiveConnections("api-1")).isEqualTo(1);
        loadBalancer.recordConnectionEnd("api-1");
        assertThat(loadBalancer.getActiveConnections("api-1")).isZero();
    }

    @Test
    @DisplayName("should switch strategy at runtime")
    void shouldSwitchStrategy() {
        register("api-1", InstanceStatus.HEALTHY);
        register("api-2", InstanceStatus.HEALTHY);
        loadBalancer.recordConnectionStart("api-1");

        loadBalancer.setStrategy(new LeastConnectionsStrategy());

        assertThat(loadBalancer.getStrategy().getName()).isEqualTo("least-connections");
        assertThat(loadBalancer.select("api")).map(ServiceInstance::getId).contains("api-2");
        assertThat(loadBalancer.getStats().strategy()).isEqualTo("least-connections");
    }

    @Test
    @DisplayName("should aggregate stats across instances")
    void shouldAggregateStats() {
        register("api-1", InstanceStatus.HEALTHY);
        register("api-2", InstanceStatus.HEALTHY);
        loadBalancer.recordRequest("api-1", 100, true);
        loadBalancer.recordRequest("api-2", 300, false);

        LoadBalancer.LoadBalancerStats stats = loadBalancer.getStats();

        assertThat(stats.totalServices()).isEqualTo(1);
        assertThat(stats.totalRequests()).isEqualTo(2);
        assertThat(stats.instances()).extracting(InstanceMetrics.Snapshot::instanceId)
                .containsExactly("api-1", "api-2");
    }
}
