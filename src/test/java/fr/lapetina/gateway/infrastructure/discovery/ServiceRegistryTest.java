package fr.lapetina.gateway.infrastructure.discovery;

import fr.lapetina.gateway.domain.model.InstanceStatus;
import fr.lapetina.gateway.domain.model.ServiceInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceRegistryTest {

    private ServiceRegistry registry;
    private List<ServiceRegistry.RegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        events = new ArrayList<>();
        registry.addListener(events::add);
    }

    private static ServiceInstance instance(String name, String id, String... tags) {
        return ServiceInstance.builder()
                .id(id)
                .name(name)
                .host("localhost")
                .port(8080)
                .tags(Set.of(tags))
                .build();
    }

    @Test
    @DisplayName("should register instances as UNKNOWN and hide them from discovery")
    void shouldRegisterAsUnknown() {
        ServiceInstance api = instance("api", "api-1");

        registry.register(api);

        assertThat(api.getStatus()).isEqualTo(InstanceStatus.UNKNOWN);
        assertThat(registry.getInstances("api")).containsExactly(api);
        assertThat(registry.discover("api")).isEmpty();
        assertThat(events).extracting(ServiceRegistry.RegistryEvent::type)
                .containsExactly(ServiceRegistry.RegistryEvent.Type.REGISTERED);
    }

    @Test
    @DisplayName("should replace an instance registered twice with the same id")
    void shouldReplaceOnReRegistration() {
        registry.register(instance("api", "api-1"));
        ServiceInstance replacement = instance("api", "api-1", "v2");

        registry.register(replacement);

        assertThat(registry.getInstances("api")).hasSize(1);
        assertThat(registry.getInstances("api").get(0)).isSameAs(replacement);
        assertThat(registry.getInstances("api").get(0).getTags()).containsExactly("v2");
    }

    @Test
    @DisplayName("should discover only healthy instances carrying every requested tag")
    void shouldFilterOnHealthAndTags() {
        ServiceInstance primary = instance("api", "api-1", "eu", "primary");
        ServiceInstance secondary = instance("api", "api-2", "eu");
        ServiceInstance down = instance("api", "api-3", "eu", "primary");
        registry.register(primary);
        registry.register(secondary);
        registry.register(down);
        registry.updateStatus(primary, InstanceStatus.HEALTHY);
        registry.updateStatus(secondary, InstanceStatus.HEALTHY);
        registry.updateStatus(down, InstanceStatus.UNHEALTHY);

        assertThat(registry.discover("api")).containsExactly(primary, secondary);
        assertThat(registry.discover("api", Set.of("eu", "primary"))).containsExactly(primary);
        assertThat(registry.discover("api", Set.of("us"))).isEmpty();
        assertThat(registry.discover("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should pick one healthy instance or nothing")
    void shouldPickOne() {
        ServiceInstance api = instance("api", "api-1");
        registry.register(api);

        assertThat(registry.pickOne("api", Set.of())).isEmpty();

        registry.updateStatus(api, InstanceStatus.HEALTHY);

        assertThat(registry.pickOne("api", Set.of())).contains(api);
    }

    @Test
    @DisplayName("should emit RECOVERED and UNHEALTHY only on transitions")
    void shouldEmitStatusTransitions() {
        ServiceInstance api = instance("api", "api-1");
        registry.register(api);
        events.clear();

        registry.updateStatus(api, InstanceStatus.HEALTHY);
        registry.updateStatus(api, InstanceStatus.HEALTHY);
        registry.updateStatus(api, InstanceStatus.UNHEALTHY);
        registry.updateStatus(api, InstanceStatus.UNHEALTHY);

        assertThat(events).extracting(ServiceRegistry.RegistryEvent::type)
                .containsExactly(ServiceRegistry.RegistryEvent.Type.RECOVERED,
                        ServiceRegistry.RegistryEvent.Type.UNHEALTHY);
    }

    @Test
    @DisplayName("should deregister and drop the service name once empty")
    void shouldDeregister() {
        registry.register(instance("api", "api-1"));

        assertThat(registry.deregister("api", "api-1")).isPresent();
        assertThat(registry.deregister("api", "api-1")).isEmpty();

        assertThat(registry.getAllServices()).doesNotContainKey("api");
        assertThat(events).extracting(ServiceRegistry.RegistryEvent::type)
                .containsExactly(ServiceRegistry.RegistryEvent.Type.REGISTERED,
                        ServiceRegistry.RegistryEvent.Type.DEREGISTERED);
    }

    @Test
    @DisplayName("should report dependency availability from healthy instances")
    void shouldCheckDependencies() {
        ServiceInstance auth = instance("auth", "auth-1");
        registry.register(auth);
        registry.register(instance("db", "db-1"));
        registry.updateStatus(auth, InstanceStatus.HEALTHY);

        assertThat(registry.checkDependencies(List.of("auth", "db", "cache")))
                .containsEntry("auth", true)
                .containsEntry("db", false)
                .containsEntry("cache", false);
    }

    @Test
    @DisplayName("should keep registering when a listener throws")
    void shouldSurviveFailingListener() {
        registry.addListener(event -> {
            throw new IllegalStateException("boom");
        });

        registry.register(instance("api", "api-1"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.getStats().totalServices()).isEqualTo(1);
    }
}
