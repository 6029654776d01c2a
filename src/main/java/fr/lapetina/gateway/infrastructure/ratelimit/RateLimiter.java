package fr.lapetina.gateway.infrastructure.ratelimit;

import fr.lapetina.gateway.domain.exception.RateLimitExceededException;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-window rate limiter with a bounded overflow queue per key.
 *
 * Within a window the first {@code maxRequests} calls are admitted at once.
 * Further calls wait in a FIFO queue of at most {@code queueSize} entries
 * until the window resets, and are rejected with {@code QUEUE_FULL} when the
 * queue is full or {@code QUEUE_TIMEOUT} when they wait too long.
 *
 * Each key's entry is mutated under its own lock. A queued waiter is resolved
 * exactly once: whoever removes it from the queue (drain or timeout) completes it.
 */
public final class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    // Log a warning once a key has used this share of its window budget
    private static final double WARNING_THRESHOLD = 0.8;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final Duration cleanupInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> cleanupTask;

    public RateLimiter(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limiter");
            t.setDaemon(true);
            return t;
        });
    }

    public RateLimiter() {
        this(Duration.ofSeconds(60));
    }

    /**
     * Starts the periodic cleanup of idle, expired entries.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            cleanupTask = scheduler.scheduleWithFixedDelay(
                    this::cleanup,
                    cleanupInterval.toMillis(),
                    cleanupInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Rate limiter started: cleanupIntervalMs={}", cleanupInterval.toMillis());
        }
    }

    /**
     * Requests admission for a key.
     *
     * @return a completed future when admitted immediately, a pending future
     *         when queued, or a future failed with {@link RateLimitExceededException}
     */
    public CompletableFuture<Void> acquire(String key, RateLimitRule rule) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry(k, rule));
        List<Waiter> released;
        CompletableFuture<Void> result;

        synchronized (entry) {
            if (entries.get(key) != entry) {
                // Removed by cleanup before we took the lock
                return acquire(key, rule);
            }
            long now = System.currentTimeMillis();
            released = entry.rollWindowIfExpired(now);

            if (entry.count < rule.maxRequests()) {
                entry.count++;
                if (entry.count >= rule.maxRequests() * WARNING_THRESHOLD && !entry.warningLogged) {
                    entry.warningLogged = true;
                    log.warn("Rate limit threshold reached: key={}, count={}, max={}",
                            key, entry.count, rule.maxRequests());
                }
                result = CompletableFuture.completedFuture(null);
            } else if (entry.queue.size() >= rule.queueSize()) {
                entry.rejected++;
                log.warn("Rate limit exceeded, queue full: key={}, queueSize={}", key, rule.queueSize());
                result = CompletableFuture.failedFuture(
                        new RateLimitExceededException(RateLimitExceededException.Reason.QUEUE_FULL, key));
            } else {
                result = enqueue(entry, now);
            }
        }

        completeAll(released);
        return result;
    }

    // Caller holds the entry lock
    private CompletableFuture<Void> enqueue(Entry entry, long now) {
        Waiter waiter = new Waiter();
        entry.queue.addLast(waiter);
        waiter.timeoutTask = scheduler.schedule(
                () -> expire(entry, waiter),
                entry.rule.queueTimeoutMs(),
                TimeUnit.MILLISECONDS
        );
        scheduleDrain(entry, now);
        log.info("Request queued: key={}, queueLength={}, windowResetInMs={}",
                entry.key, entry.queue.size(), entry.windowResetTime - now);
        return waiter.future;
    }

    // Caller holds the entry lock
    private void scheduleDrain(Entry entry, long now) {
        if (entry.drainTask != null && !entry.drainTask.isDone()) {
            return;
        }
        long delay = Math.max(0, entry.windowResetTime - now);
        entry.drainTask = scheduler.schedule(() -> drain(entry), delay, TimeUnit.MILLISECONDS);
    }

    private void drain(Entry entry) {
        List<Waiter> released;
        synchronized (entry) {
            long now = System.currentTimeMillis();
            released = entry.rollWindowIfExpired(now);
            entry.drainTask = null;
            if (!entry.queue.isEmpty()) {
                scheduleDrain(entry, now);
            }
        }
        if (!released.isEmpty()) {
            log.debug("Rate limit queue drained: key={}, admitted={}", entry.key, released.size());
        }
        completeAll(released);
    }

    private void expire(Entry entry, Waiter waiter) {
        boolean removed;
        synchronized (entry) {
            removed = removeByIdentity(entry.queue, waiter);
            if (removed) {
                entry.timedOut++;
            }
        }
        if (removed) {
            log.warn("Request timed out in rate limit queue: key={}, timeoutMs={}",
                    entry.key, entry.rule.queueTimeoutMs());
            waiter.future.completeExceptionally(
                    new RateLimitExceededException(RateLimitExceededException.Reason.QUEUE_TIMEOUT, entry.key));
        }
    }

    private static boolean removeByIdentity(Deque<Waiter> queue, Waiter waiter) {
        var iterator = queue.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() == waiter) {
                iterator.remove();
                return true;
            }
        }
        return false;
    }

    private static void completeAll(List<Waiter> released) {
        for (Waiter waiter : released) {
            waiter.future.complete(null);
        }
    }

    /**
     * Removes entries whose window has passed and whose queue is empty.
     */
    public int cleanup() {
        long now = System.currentTimeMillis();
        int removed = 0;
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                if (now >= entry.windowResetTime && entry.queue.isEmpty()
                        && entries.remove(entry.key, entry)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Rate limit entries cleaned up: removed={}, remaining={}", removed, entries.size());
        }
        return removed;
    }

    /**
     * Current window state for a key, empty when the key has no entry.
     */
    public Optional<RateLimitStatus> getStatus(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            long now = System.currentTimeMillis();
            int count = now >= entry.windowResetTime ? 0 : entry.count;
            return Optional.of(new RateLimitStatus(
                    key,
                    count,
                    Math.max(0, entry.rule.maxRequests() - count),
                    Instant.ofEpochMilli(entry.windowResetTime),
                    entry.queue.size()
            ));
        }
    }

    public RateLimiterStats getStats() {
        List<KeyStats> perKey = new ArrayList<>();
        int totalQueued = 0;
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                totalQueued += entry.queue.size();
                perKey.add(new KeyStats(entry.key, entry.count, entry.queue.size(), entry.rejected, entry.timedOut));
            }
        }
        List<KeyStats> top = perKey.stream()
                .sorted(Comparator.comparingLong((KeyStats s) -> s.rejected() + s.timedOut())
                        .thenComparingInt(KeyStats::count)
                        .reversed())
                .limit(10)
                .toList();
        double averageQueueLength = perKey.isEmpty() ? 0.0 : (double) totalQueued / perKey.size();
        return new RateLimiterStats(perKey.size(), totalQueued, averageQueueLength, top);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        running.set(false);
        ScheduledFuture<?> task = cleanupTask;
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Rate limiter scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Entry entry : entries.values()) {
            List<Waiter> pending;
            synchronized (entry) {
                pending = new ArrayList<>(entry.queue);
                entry.queue.clear();
            }
            pending.forEach(waiter -> waiter.future.cancel(false));
        }
        log.info("Rate limiter stopped");
    }

    /**
     * Per-key window state. All fields are guarded by the entry itself.
     */
    private static final class Entry {
        private final String key;
        private final RateLimitRule rule;
        private final Deque<Waiter> queue = new ArrayDeque<>();
        private int count;
        private long windowResetTime;
        private boolean warningLogged;
        private long rejected;
        private long timedOut;
        private ScheduledFuture<?> drainTask;

        Entry(String key, RateLimitRule rule) {
            this.key = key;
            this.rule = rule;
            this.windowResetTime = System.currentTimeMillis() + rule.windowMs();
        }

        /**
         * Starts a fresh window when the current one has passed, admitting
         * queued waiters in FIFO order up to the new budget.
         *
         * @return waiters to complete once the lock is released
         */
        List<Waiter> rollWindowIfExpired(long now) {
            if (now < windowResetTime) {
                return List.of();
            }
            count = 0;
            warningLogged = false;
            windowResetTime = now + rule.windowMs();

            List<Waiter> released = new ArrayList<>();
            while (!queue.isEmpty() && count < rule.maxRequests()) {
                Waiter waiter = queue.pollFirst();
                if (waiter.timeoutTask != null) {
                    waiter.timeoutTask.cancel(false);
                }
                count++;
                released.add(waiter);
            }
            return released;
        }
    }

    private static final class Waiter {
        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private ScheduledFuture<?> timeoutTask;
    }

    public record RateLimitStatus(String key, int count, int remaining, Instant resetTime, int queueLength) {
    }

    public record KeyStats(String key, int count, int queueLength, long rejected, long timedOut) {
    }

    public record RateLimiterStats(
            int totalKeys,
            int totalQueuedRequests,
            double averageQueueLength,
            List<KeyStats> topLimitedKeys
    ) {
    }
}
