package fr.lapetina.gateway.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating load balancing strategies by name.
 *
 * Names are matched case-insensitively and underscores are treated as
 * hyphens, so {@code health_based} and {@code health-based} are equivalent.
 * Supports runtime strategy switching without service restart.
 */
public final class StrategyFactory {

    public static final String DEFAULT_STRATEGY = "health-based";

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register("round-robin", RoundRobinStrategy::new);
        register("least-connections", LeastConnectionsStrategy::new);
        register("weighted-round-robin", WeightedRoundRobinStrategy::new);
        register("random", RandomStrategy::new);
        register("health-based", HealthBasedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(normalize(name), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static LoadBalancingStrategy createOrDefault(String name, LoadBalancingStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    public static boolean isKnown(String name) {
        return name != null && REGISTRY.containsKey(normalize(name));
    }

    /**
     * Returns all registered strategy names.
     */
    public static Set<String> getRegisteredNames() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
