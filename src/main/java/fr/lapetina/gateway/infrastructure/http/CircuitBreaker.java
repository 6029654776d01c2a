package fr.lapetina.gateway.infrastructure.http;

import fr.lapetina.gateway.domain.exception.CallTimeoutException;
import fr.lapetina.gateway.domain.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding an asynchronous call site.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures exceeded threshold, calls rejected without invoking the target
 * - HALF_OPEN: After recovery timeout, calls are let through as probes
 *
 * State transitions happen under the breaker's lock; counters read by
 * stats are atomic. Outcomes are recorded before the caller's future
 * completes, so state is consistent when the caller observes the result.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final ScheduledExecutorService timer;
    private final List<Consumer<CircuitBreakerEvent>> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant nextAttemptTime = Instant.EPOCH;

    private volatile Instant lastFailureTime;
    private volatile Instant lastSuccessTime;
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();
    private final AtomicLong totalSuccesses = new AtomicLong();

    public CircuitBreaker(String name, CircuitBreakerConfig config, ScheduledExecutorService timer) {
        this.name = name;
        this.config = config;
        this.timer = timer;
    }

    /**
     * Executes the call through the breaker using the configured per-call timeout.
     *
     * @param call starts the operation; not invoked while the circuit is open
     * @return future completing with the call's result, or failing with the
     *         call's error, {@link CircuitOpenException} or {@link CallTimeoutException}
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletableFuture<T>> call) {
        return execute(call, config.timeout());
    }

    /**
     * Executes the call with an explicit per-call timeout. When the timeout
     * fires first, the underlying future is cancelled.
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletableFuture<T>> call, Duration timeout) {
        totalRequests.incrementAndGet();

        Instant rejectedUntil = acquirePermission();
        if (rejectedUntil != null) {
            log.debug("Call rejected by open circuit: breaker={}, nextAttempt={}", name, rejectedUntil);
            notifyListeners(new CircuitBreakerEvent(CircuitBreakerEvent.Type.REQUEST_REJECTED, name, State.OPEN, null));
            return CompletableFuture.failedFuture(new CircuitOpenException(name, rejectedUntil));
        }

        CompletableFuture<T> underlying;
        try {
            underlying = call.get();
        } catch (RuntimeException e) {
            onFailure(e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean(false);

        ScheduledFuture<?> timeoutTask = timer.schedule(() -> {
            if (settled.compareAndSet(false, true)) {
                CallTimeoutException timeoutError = new CallTimeoutException(name, timeout);
                onFailure(timeoutError);
                underlying.cancel(true);
                result.completeExceptionally(timeoutError);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        underlying.whenComplete((value, error) -> {
            timeoutTask.cancel(false);
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            if (error == null) {
                onSuccess();
                result.complete(value);
            } else {
                Throwable cause = unwrap(error);
                onFailure(cause);
                result.completeExceptionally(cause);
            }
        });

        return result;
    }

    /**
     * Returns null when the call may proceed, otherwise the time before which
     * calls are rejected.
     */
    private synchronized Instant acquirePermission() {
        if (state != State.OPEN) {
            return null;
        }
        Instant now = Instant.now();
        if (now.isBefore(nextAttemptTime)) {
            return nextAttemptTime;
        }
        successCount = 0;
        transitionTo(State.HALF_OPEN);
        return null;
    }

    private void onSuccess() {
        lastSuccessTime = Instant.now();
        totalSuccesses.incrementAndGet();
        State current;
        synchronized (this) {
            failureCount = 0;
            if (state == State.HALF_OPEN) {
                successCount++;
                if (successCount >= config.successThreshold()) {
                    transitionTo(State.CLOSED);
                }
            }
            current = state;
        }
        notifyListeners(new CircuitBreakerEvent(CircuitBreakerEvent.Type.REQUEST_SUCCEEDED, name, current, null));
    }

    private void onFailure(Throwable error) {
        Instant now = Instant.now();
        totalFailures.incrementAndGet();
        State current;
        synchronized (this) {
            lastFailureTime = now;
            if (state == State.HALF_OPEN) {
                nextAttemptTime = now.plus(config.recoveryTimeout());
                log.warn("Circuit breaker OPENED (half-open failure): breaker={}, error={}",
                        name, error.getMessage());
                transitionTo(State.OPEN);
            } else if (state == State.CLOSED) {
                failureCount++;
                if (failureCount >= config.failureThreshold()) {
                    nextAttemptTime = now.plus(config.recoveryTimeout());
                    log.warn("Circuit breaker OPENED: breaker={}, failures={}, nextAttempt={}",
                            name, failureCount, nextAttemptTime);
                    transitionTo(State.OPEN);
                }
            }
            current = state;
        }
        notifyListeners(new CircuitBreakerEvent(CircuitBreakerEvent.Type.REQUEST_FAILED, name, current, error));
    }

    // Caller holds the lock
    private void transitionTo(State newState) {
        State old = state;
        if (old == newState) {
            return;
        }
        state = newState;
        log.info("Circuit breaker state changed: breaker={}, {} -> {}", name, old, newState);
        notifyListeners(new CircuitBreakerEvent(CircuitBreakerEvent.Type.STATE_CHANGED, name, newState, null));
    }

    /**
     * Forces CLOSED with zero counters. Administrative override.
     */
    public void reset() {
        synchronized (this) {
            failureCount = 0;
            successCount = 0;
            nextAttemptTime = Instant.EPOCH;
            transitionTo(State.CLOSED);
        }
        totalRequests.set(0);
        totalFailures.set(0);
        totalSuccesses.set(0);
        lastFailureTime = null;
        lastSuccessTime = null;
        log.info("Circuit breaker reset: breaker={}", name);
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
                name,
                state,
                failureCount,
                successCount,
                totalRequests.get(),
                totalFailures.get(),
                totalSuccesses.get(),
                lastFailureTime,
                lastSuccessTime,
                state == State.OPEN ? nextAttemptTime : null
        );
    }

    public void addListener(Consumer<CircuitBreakerEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<CircuitBreakerEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(CircuitBreakerEvent event) {
        for (Consumer<CircuitBreakerEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying circuit breaker listener: breaker={}", name, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + getState() +
                ", failures=" + getFailureCount() +
                '}';
    }

    /**
     * Event emitted on state changes and call outcomes.
     */
    public record CircuitBreakerEvent(Type type, String breakerName, State state, Throwable error) {
        public enum Type {
            STATE_CHANGED,
            REQUEST_SUCCEEDED,
            REQUEST_FAILED,
            REQUEST_REJECTED
        }
    }
}
