package fr.lapetina.gateway.lifecycle;

import fr.lapetina.gateway.domain.exception.ConfigurationException;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import fr.lapetina.gateway.infrastructure.discovery.ServiceRegistry;
import fr.lapetina.gateway.integration.TestGatewayFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceManagerTest {

    private TestGatewayFactory factory;
    private ServiceManager serviceManager;
    private ServiceRegistry registry;
    private List<LifecycleEvent> events;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create();
        serviceManager = factory.getServiceManager();
        registry = factory.getServiceRegistry();
        events = new CopyOnWriteArrayList<>();
        serviceManager.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    private static ServiceDefinition.Builder service(String name, String... dependencies) {
        return ServiceDefinition.builder()
                .name(name)
                .port(9000)
                .dependsOn(dependencies)
                .startupTimeout(Duration.ofMillis(300))
                .shutdownTimeout(Duration.ofMillis(500));
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
            throw new AssertionError("Expected the future to fail");
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    @Nested
    @DisplayName("Dependency ordering")
    class Ordering {

        @Test
        @DisplayName("should start dependencies before their dependents")
        void shouldOrderByDependencies() {
            serviceManager.registerService(service("a", "b").build());
            serviceManager.registerService(service("b", "c").build());
            serviceManager.registerService(service("c").build());

            assertThat(serviceManager.calculateStartupOrder()).containsExactly("c", "b", "a");
            assertThat(serviceManager.calculateShutdownOrder()).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("should ignore dependencies that are not managed here")
        void shouldIgnoreUnmanagedDependencies() {
            serviceManager.registerService(service("a", "external-db").build());

            assertThat(serviceManager.calculateStartupOrder()).containsExactly("a");
        }

        @Test
        @DisplayName("should reject circular dependencies")
        void shouldRejectCycles() {
            serviceManager.registerService(service("a", "b").build());
            serviceManager.registerService(service("b", "a").build());

            assertThatThrownBy(() -> serviceManager.calculateStartupOrder())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Circular dependency detected involving:");
            assertThatThrownBy(() -> serviceManager.startAllServices())
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Single service lifecycle")
    class SingleService {

        @Test
        @DisplayName("should start a service once its health endpoint answers")
        void shouldStartHealthyService() throws Exception {
            serviceManager.registerService(service("auth").build());

            ServiceStatus status = serviceManager.startService("auth").get(5, TimeUnit.SECONDS);

            assertThat(status.state()).isEqualTo(LifecycleState.RUNNING);
            assertThat(status.startedAt()).isNotNull();
            assertThat(status.instanceId()).startsWith("auth-");
            assertThat(registry.discover("auth")).extracting(ServiceInstance::getId)
                    .containsExactly(status.instanceId());
            assertThat(events).extracting(LifecycleEvent::type).containsSubsequence(
                    LifecycleEvent.Type.REGISTERED, LifecycleEvent.Type.STARTING, LifecycleEvent.Type.STARTED);
        }

        @Test
        @DisplayName("should fail when a dependency has no healthy instance")
        void shouldFailOnMissingDependency() throws Exception {
            serviceManager.registerService(service("auth").build());
            serviceManager.registerService(service("voice", "auth").build());

            Throwable failure = failureOf(serviceManager.startService("voice"));

            assertThat(failure).isInstanceOf(ServiceLifecycleException.class)
                    .hasMessage("Dependency not available: auth");
            ServiceStatus status = serviceManager.getServiceStatus("voice").orElseThrow();
            assertThat(status.state()).isEqualTo(LifecycleState.FAILED);
            assertThat(status.dependencies()).containsEntry("auth", false);
            assertThat(registry.getInstances("voice")).isEmpty();
        }

        @Test
        @DisplayName("should fail and deregister when the service never becomes healthy")
        void shouldTimeOutUnhealthyService() throws Exception {
            factory.setUnhealthy("auth");
            serviceManager.registerService(service("auth").build());

            Throwable failure = failureOf(serviceManager.startService("auth"));

            assertThat(failure).hasMessage("Service health check timeout: auth");
            assertThat(registry.getInstances("auth")).isEmpty();
            assertThat(serviceManager.getServiceStatus("auth").orElseThrow().error())
                    .isEqualTo("Service health check timeout: auth");
            assertThat(events).extracting(LifecycleEvent::type).contains(LifecycleEvent.Type.FAILED);
        }

        @Test
        @DisplayName("should restart a failed service")
        void shouldRestartFailedService() throws Exception {
            factory.setUnhealthy("auth");
            serviceManager.registerService(service("auth").build());
            failureOf(serviceManager.startService("auth"));

            factory.setHealthy("auth");
            ServiceStatus status = serviceManager.startService("auth").get(5, TimeUnit.SECONDS);

            assertThat(status.state()).isEqualTo(LifecycleState.RUNNING);
            assertThat(status.error()).isNull();
        }

        @Test
        @DisplayName("should deregister instances on stop")
        void shouldStopService() throws Exception {
            serviceManager.registerService(service("auth").build());
            serviceManager.startService("auth").get(5, TimeUnit.SECONDS);

            ServiceStatus status = serviceManager.stopService("auth").get(5, TimeUnit.SECONDS);

            assertThat(status.state()).isEqualTo(LifecycleState.STOPPED);
            assertThat(status.stoppedAt()).isNotNull();
            assertThat(registry.getInstances("auth")).isEmpty();
        }

        @Test
        @DisplayName("should wait for in-flight calls before reporting stopped")
        void shouldDrainInFlightCalls() throws Exception {
            serviceManager.registerService(service("auth").shutdownTimeout(Duration.ofSeconds(5)).build());
            ServiceStatus running = serviceManager.startService("auth").get(5, TimeUnit.SECONDS);
            factory.getLoadBalancer().recordConnectionStart(running.instanceId());

            CompletableFuture<ServiceStatus> stopping = serviceManager.stopService("auth");
            Thread.sleep(250);
            assertThat(stopping).isNotDone();

            factory.getLoadBalancer().recordConnectionEnd(running.instanceId());

            assertThat(stopping.get(5, TimeUnit.SECONDS).state()).isEqualTo(LifecycleState.STOPPED);
        }

        @Test
        @DisplayName("should give up draining after the shutdown timeout")
        void shouldStopAfterShutdownTimeout() throws Exception {
            serviceManager.registerService(service("auth").shutdownTimeout(Duration.ofMillis(200)).build());
            ServiceStatus running = serviceManager.startService("auth").get(5, TimeUnit.SECONDS);
            factory.getLoadBalancer().recordConnectionStart(running.instanceId());

            ServiceStatus stopped = serviceManager.stopService("auth").get(5, TimeUnit.SECONDS);

            assertThat(stopped.state()).isEqualTo(LifecycleState.STOPPED);
        }

        @Test
        @DisplayName("should reject unknown services synchronously")
        void shouldRejectUnknownService() {
            assertThatThrownBy(() -> serviceManager.startService("ghost"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("ghost");
            assertThatThrownBy(() -> serviceManager.stopService("ghost"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should expose the routes of a registered service")
        void shouldRegisterRoutes() {
            serviceManager.registerService(service("auth")
                    .addRoute(RouteConfig.builder().method("post").path("/api/auth/login").serviceName("ignored").build())
                    .build());

            assertThat(factory.getGateway().findRoute("POST", "/api/auth/login"))
                    .get()
                    .extracting(RouteConfig::getServiceName)
                    .isEqualTo("auth");
        }
    }

    @Nested
    @DisplayName("Bulk lifecycle")
    class Bulk {

        @Test
        @DisplayName("should start every service in dependency order")
        void shouldStartAll() throws Exception {
            serviceManager.registerService(service("voice", "auth").build());
            serviceManager.registerService(service("auth").addTag(ServiceDefinition.CRITICAL_TAG).build());

            serviceManager.startAllServices().get(5, TimeUnit.SECONDS);

            assertThat(serviceManager.getStats().running()).isEqualTo(2);
            assertThat(events).filteredOn(e -> e.type() == LifecycleEvent.Type.STARTED)
                    .extracting(LifecycleEvent::serviceName)
                    .containsExactly("auth", "voice");
            assertThat(events).extracting(LifecycleEvent::type).endsWith(LifecycleEvent.Type.ALL_STARTED);
        }

        @Test
        @DisplayName("should abort when a critical service fails")
        void shouldAbortOnCriticalFailure() throws Exception {
            factory.setUnhealthy("auth");
            serviceManager.registerService(service("auth").addTag(ServiceDefinition.CRITICAL_TAG).build());
            serviceManager.registerService(service("voice", "auth").build());

            Throwable failure = failureOf(serviceManager.startAllServices());

            assertThat(failure).isInstanceOf(ServiceLifecycleException.class)
                    .hasMessage("Critical service failed to start: auth");
            assertThat(serviceManager.getServiceStatus("voice").orElseThrow().state())
                    .isEqualTo(LifecycleState.STOPPED);
            assertThat(events).extracting(LifecycleEvent::type).doesNotContain(LifecycleEvent.Type.ALL_STARTED);
        }

        @Test
        @DisplayName("should continue past a non-critical failure")
        void shouldContinuePastNonCriticalFailure() throws Exception {
            factory.setUnhealthy("analytics");
            serviceManager.registerService(service("analytics").build());
            serviceManager.registerService(service("auth").build());

            serviceManager.startAllServices().get(5, TimeUnit.SECONDS);

            assertThat(serviceManager.getServiceStatus("analytics").orElseThrow().state())
                    .isEqualTo(LifecycleState.FAILED);
            assertThat(serviceManager.getServiceStatus("auth").orElseThrow().state())
                    .isEqualTo(LifecycleState.RUNNING);
            ServiceManager.LifecycleStats stats = serviceManager.getStats();
            assertThat(stats.totalServices()).isEqualTo(2);
            assertThat(stats.failed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should stop every service in reverse order")
        void shouldStopAll() throws Exception {
            serviceManager.registerService(service("auth").build());
            serviceManager.registerService(service("voice", "auth").build());
            serviceManager.startAllServices().get(5, TimeUnit.SECONDS);
            events.clear();

            serviceManager.stopAllServices().get(5, TimeUnit.SECONDS);

            assertThat(events).filteredOn(e -> e.type() == LifecycleEvent.Type.STOPPED)
                    .extracting(LifecycleEvent::serviceName)
                    .containsExactly("voice", "auth");
            assertThat(registry.getAllInstances()).isEmpty();
        }
    }
}
