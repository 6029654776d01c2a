package fr.lapetina.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;

import java.util.Set;

/**
 * Admin view of a gateway route.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteView(
        String method,
        String path,
        String serviceName,
        String targetPath,
        Set<String> tags,
        long timeoutMs,
        RateLimitView rateLimit,
        boolean transformed
) {
    public static RouteView fromRoute(RouteConfig route) {
        return new RouteView(
                route.getMethod(),
                route.getPath(),
                route.getServiceName(),
                route.getTargetPath(),
                route.getTags(),
                route.getTimeout().toMillis(),
                route.getRateLimit().map(RateLimitView::fromRule).orElse(null),
                route.hasTransforms()
        );
    }

    public record RateLimitView(long windowMs, int maxRequests, int queueSize, long queueTimeoutMs) {
        static RateLimitView fromRule(RateLimitRule rule) {
            return new RateLimitView(rule.windowMs(), rule.maxRequests(), rule.queueSize(), rule.queueTimeoutMs());
        }
    }
}
