package fr.lapetina.gateway.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Named circuit breakers with get-or-create semantics.
 *
 * Breakers live for the lifetime of the registry. The registry owns the
 * timer thread used to enforce per-call timeouts.
 */
public final class CircuitBreakerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<Consumer<CircuitBreaker.CircuitBreakerEvent>> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<CircuitBreaker>> creationListeners = new CopyOnWriteArrayList<>();
    private final CircuitBreakerConfig defaultConfig;
    private final ScheduledExecutorService timer;

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this.defaultConfig = defaultConfig;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "circuit-breaker-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults());
    }

    /**
     * Returns the breaker for a name, creating it with the default config.
     */
    public CircuitBreaker get(String name) {
        return get(name, defaultConfig);
    }

    /**
     * Returns the breaker for a name, creating it with the given config.
     * The config only applies when the breaker does not exist yet.
     */
    public CircuitBreaker get(String name, CircuitBreakerConfig config) {
        CircuitBreaker existing = breakers.get(name);
        if (existing != null) {
            return existing;
        }
        boolean[] created = new boolean[1];
        CircuitBreaker breaker = breakers.computeIfAbsent(name, key -> {
            CircuitBreaker newBreaker = new CircuitBreaker(key, config, timer);
            listeners.forEach(newBreaker::addListener);
            created[0] = true;
            return newBreaker;
        });
        if (created[0]) {
            log.info("Circuit breaker created: breaker={}, failureThreshold={}, recoveryTimeoutMs={}, timeoutMs={}",
                    name, config.failureThreshold(), config.recoveryTimeout().toMillis(), config.timeout().toMillis());
            for (Consumer<CircuitBreaker> listener : creationListeners) {
                try {
                    listener.accept(breaker);
                } catch (Exception e) {
                    log.error("Error notifying breaker creation listener: breaker={}", name, e);
                }
            }
        }
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> getAll() {
        return List.copyOf(breakers.values());
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new LinkedHashMap<>();
        breakers.keySet().stream().sorted()
                .forEach(name -> stats.put(name, breakers.get(name).getStats()));
        return stats;
    }

    /**
     * Resets one breaker. Returns false when no breaker has that name.
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("All circuit breakers reset: count={}", breakers.size());
    }

    public boolean remove(String name) {
        CircuitBreaker removed = breakers.remove(name);
        if (removed != null) {
            log.info("Circuit breaker removed: breaker={}", name);
            return true;
        }
        return false;
    }

    /**
     * Adds a listener to every existing and future breaker.
     */
    public void addListener(Consumer<CircuitBreaker.CircuitBreakerEvent> listener) {
        listeners.add(listener);
        breakers.values().forEach(breaker -> breaker.addListener(listener));
    }

    /**
     * Adds a callback invoked once for each newly created breaker.
     */
    public void onBreakerCreated(Consumer<CircuitBreaker> listener) {
        creationListeners.add(listener);
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig;
    }

    public int size() {
        return breakers.size();
    }

    @Override
    public void close() {
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Circuit breaker timer did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Circuit breaker registry closed: breakers={}", breakers.size());
    }
}
