package fr.lapetina.gateway.domain.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling per-instance metrics used by the load balancer.
 *
 * Response time and error rate are exponential moving averages. Their
 * read-modify-write happens under the instance lock; connection counts
 * are atomic.
 */
public final class InstanceMetrics {

    public static final double SMOOTHING_FACTOR = 0.1;

    private final String instanceId;
    private volatile int weight;
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicLong totalRequests = new AtomicLong(0);

    private double averageResponseTime;
    private double errorRate;
    private volatile Instant lastRequestTime;

    public InstanceMetrics(String instanceId, int weight) {
        this.instanceId = instanceId;
        this.weight = weight;
    }

    public synchronized void recordRequest(long responseTimeMs, boolean success) {
        totalRequests.incrementAndGet();
        lastRequestTime = Instant.now();
        averageResponseTime = SMOOTHING_FACTOR * responseTimeMs + (1 - SMOOTHING_FACTOR) * averageResponseTime;
        double failure = success ? 0.0 : 1.0;
        errorRate = SMOOTHING_FACTOR * failure + (1 - SMOOTHING_FACTOR) * errorRate;
    }

    public int connectionStarted() {
        return activeConnections.incrementAndGet();
    }

    /**
     * Decrements active connections, never below zero.
     */
    public int connectionEnded() {
        return activeConnections.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public int getWeight() {
        return weight;
    }

    public void setWeight(int weight) {
        this.weight = weight;
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public synchronized double getAverageResponseTime() {
        return averageResponseTime;
    }

    public synchronized double getErrorRate() {
        return errorRate;
    }

    public Instant getLastRequestTime() {
        return lastRequestTime;
    }

    /**
     * Score in [0, 1]; higher is better. Blends latency, error rate and load.
     */
    public synchronized double healthScore() {
        double responseScore = 1 - Math.min(1.0, averageResponseTime / 5000.0);
        double errorScore = 1 - errorRate;
        double loadScore = 1 - Math.min(1.0, activeConnections.get() / 100.0);
        return 0.4 * responseScore + 0.4 * errorScore + 0.2 * loadScore;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(instanceId, activeConnections.get(), totalRequests.get(),
                averageResponseTime, errorRate, lastRequestTime, weight);
    }

    /**
     * Immutable view for admin queries.
     */
    public record Snapshot(
            String instanceId,
            int activeConnections,
            long totalRequests,
            double averageResponseTime,
            double errorRate,
            Instant lastRequestTime,
            int weight
    ) {
    }

    @Override
    public String toString() {
        return "InstanceMetrics{" +
                "instanceId='" + instanceId + '\'' +
                ", active=" + activeConnections.get() +
                ", total=" + totalRequests.get() +
                '}';
    }
}
