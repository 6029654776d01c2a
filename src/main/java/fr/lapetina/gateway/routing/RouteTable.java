package fr.lapetina.gateway.routing;

import fr.lapetina.gateway.domain.model.RouteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes keyed by {@code METHOD:path}. Matching is exact.
 */
public final class RouteTable {

    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    private final Map<String, RouteConfig> routes = new ConcurrentHashMap<>();

    /**
     * Adds a route, replacing any route with the same method and path.
     */
    public void register(RouteConfig route) {
        RouteConfig previous = routes.put(route.key(), route);
        if (previous != null) {
            log.info("Route replaced: {} -> {} (was {})",
                    route.key(), route.getServiceName(), previous.getServiceName());
        } else {
            log.info("Route registered: {} -> {}, targetPath={}",
                    route.key(), route.getServiceName(), route.getTargetPath());
        }
    }

    public Optional<RouteConfig> remove(String method, String path) {
        RouteConfig removed = routes.remove(RouteConfig.key(method, path));
        if (removed != null) {
            log.info("Route removed: {}", removed.key());
        }
        return Optional.ofNullable(removed);
    }

    public void clear() {
        int count = routes.size();
        routes.clear();
        log.info("Routes cleared: count={}", count);
    }

    public Optional<RouteConfig> find(String method, String path) {
        return Optional.ofNullable(routes.get(RouteConfig.key(method, path)));
    }

    /**
     * All routes sorted by key.
     */
    public List<RouteConfig> getAll() {
        return routes.values().stream()
                .sorted(Comparator.comparing(RouteConfig::key))
                .toList();
    }

    public int size() {
        return routes.size();
    }
}
