package fr.lapetina.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.gateway.domain.model.ServiceInstance;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Admin view of a registered instance.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InstanceView(
        String id,
        String name,
        String version,
        String url,
        String healthEndpoint,
        String status,
        Set<String> tags,
        List<String> dependencies,
        Map<String, Object> metadata,
        Instant registeredAt,
        Instant lastHealthCheck
) {
    public static InstanceView fromInstance(ServiceInstance instance) {
        return new InstanceView(
                instance.getId(),
                instance.getName(),
                instance.getVersion(),
                instance.getBaseUri().toString(),
                instance.getHealthEndpoint(),
                instance.getStatus().name(),
                instance.getTags(),
                instance.getDependencies(),
                instance.getMetadata(),
                instance.getRegisteredAt(),
                instance.getLastHealthCheck()
        );
    }
}
