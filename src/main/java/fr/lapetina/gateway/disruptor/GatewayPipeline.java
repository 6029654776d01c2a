package fr.lapetina.gateway.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.gateway.disruptor.handlers.AdmissionHandler;
import fr.lapetina.gateway.disruptor.handlers.CompletionHandler;
import fr.lapetina.gateway.disruptor.handlers.DispatchHandler;
import fr.lapetina.gateway.disruptor.handlers.RouteMatchHandler;
import fr.lapetina.gateway.domain.event.GatewayRequestEvent;
import fr.lapetina.gateway.domain.event.GatewayRequestEventFactory;
import fr.lapetina.gateway.domain.event.RequestRecord;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.gateway.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.gateway.routing.GatewayErrors;
import fr.lapetina.gateway.routing.ProxyExecutor;
import fr.lapetina.gateway.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Disruptor pipeline that carries inbound gateway requests.
 *
 * Stages: route match -> admission (rate limit) -> dispatch -> completion.
 * The first three stages are cheap and never block; the proxied call and
 * any rate limit queue wait continue asynchronously once dispatch returns.
 *
 * Publishing uses {@code tryNext}, so a full ring buffer is reported to the
 * caller as {@link BackpressureException} instead of blocking HTTP threads.
 * The producer type is MULTI because every inbound HTTP worker publishes.
 */
public final class GatewayPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayPipeline.class);

    private final Disruptor<GatewayRequestEvent> disruptor;
    private final RingBuffer<GatewayRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private GatewayPipeline(Builder builder) {
        ThreadFactory threadFactory = new DisruptorThreadFactory("gateway-pipeline");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new GatewayRequestEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new RouteMatchHandler(builder.routeTable))
                .then(new AdmissionHandler(builder.rateLimiter))
                .then(new DispatchHandler(builder.proxyExecutor, builder.recordSink))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("GatewayPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("GatewayPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes a request.
     *
     * @return future completing with the response; never completes exceptionally
     * @throws BackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public CompletableFuture<ProxyResponse> submit(ProxyRequest request, String requestId) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        CompletableFuture<ProxyResponse> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            GatewayRequestEvent event = ringBuffer.get(sequence);
            event.initialize(request, requestId, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: requestId={}, sequence={}", requestId, sequence);
        return responseFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down GatewayPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("GatewayPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("GatewayPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Completes the caller's future when a handler throws, so no request hangs.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<GatewayRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, GatewayRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            CompletableFuture<ProxyResponse> future = event.getResponseFuture();
            if (future != null && !future.isDone()) {
                future.complete(GatewayErrors.toResponse(ErrorType.INTERNAL_ERROR, "Internal Server Error",
                        event.getRequestId(), null, 0));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for GatewayPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private RouteTable routeTable;
        private RateLimiter rateLimiter;
        private ProxyExecutor proxyExecutor;
        private Consumer<RequestRecord> recordSink = record -> { };

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder routeTable(RouteTable routeTable) {
            this.routeTable = routeTable;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder proxyExecutor(ProxyExecutor proxyExecutor) {
            this.proxyExecutor = proxyExecutor;
            return this;
        }

        public Builder recordSink(Consumer<RequestRecord> recordSink) {
            this.recordSink = recordSink;
            return this;
        }

        public Builder fromConfig(GatewayConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            return this;
        }

        public GatewayPipeline build() {
            if (routeTable == null) {
                throw new IllegalStateException("RouteTable is required");
            }
            if (rateLimiter == null) {
                throw new IllegalStateException("RateLimiter is required");
            }
            if (proxyExecutor == null) {
                throw new IllegalStateException("ProxyExecutor is required");
            }
            return new GatewayPipeline(this);
        }
    }
}
