package fr.lapetina.gateway.domain.model;

import java.util.function.Function;

/**
 * Fixed-window limit with a bounded overflow queue.
 *
 * @param windowMs       window length
 * @param maxRequests    admissions per window
 * @param queueSize      requests allowed to wait once the window is exhausted
 * @param queueTimeoutMs how long a queued request may wait
 * @param keyResolver    derives the limiter key from a request; defaults to client address
 */
public record RateLimitRule(
        long windowMs,
        int maxRequests,
        int queueSize,
        long queueTimeoutMs,
        Function<ProxyRequest, String> keyResolver
) {
    public static final int DEFAULT_QUEUE_SIZE = 10;
    public static final long DEFAULT_QUEUE_TIMEOUT_MS = 30_000;

    public RateLimitRule {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (queueSize < 0) {
            throw new IllegalArgumentException("queueSize must not be negative");
        }
        if (queueTimeoutMs <= 0) {
            throw new IllegalArgumentException("queueTimeoutMs must be positive");
        }
        if (keyResolver == null) {
            keyResolver = ProxyRequest::clientAddress;
        }
    }

    public static RateLimitRule of(long windowMs, int maxRequests) {
        return new RateLimitRule(windowMs, maxRequests, DEFAULT_QUEUE_SIZE, DEFAULT_QUEUE_TIMEOUT_MS, null);
    }

    public static RateLimitRule of(long windowMs, int maxRequests, int queueSize, long queueTimeoutMs) {
        return new RateLimitRule(windowMs, maxRequests, queueSize, queueTimeoutMs, null);
    }

    /** 20 requests per minute, for voice processing endpoints. */
    public static RateLimitRule voice() {
        return new RateLimitRule(60_000, 20, 5, 10_000, request -> "voice:" + request.clientAddress());
    }

    /** 100 requests per 15 minutes, for general API endpoints. */
    public static RateLimitRule api() {
        return new RateLimitRule(15 * 60_000, 100, 20, 30_000, request -> "api:" + request.clientAddress());
    }
}
