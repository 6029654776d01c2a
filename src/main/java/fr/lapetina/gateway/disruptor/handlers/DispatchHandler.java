package fr.lapetina.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.gateway.domain.event.EventState;
import fr.lapetina.gateway.domain.event.GatewayRequestEvent;
import fr.lapetina.gateway.domain.event.RequestRecord;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.routing.GatewayErrors;
import fr.lapetina.gateway.routing.ProxyExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Third stage handler: hands admitted requests to the proxy and completes
 * the caller's future.
 *
 * IMPORTANT: the proxy call runs asynchronously after this handler returns,
 * and the event is recycled right after. Everything the continuation needs
 * is copied off the event before chaining.
 */
public final class DispatchHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final ProxyExecutor proxyExecutor;
    private final Consumer<RequestRecord> recordSink;

    public DispatchHandler(ProxyExecutor proxyExecutor, Consumer<RequestRecord> recordSink) {
        this.proxyExecutor = proxyExecutor;
        this.recordSink = recordSink;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<ProxyResponse> future = event.getResponseFuture();
        if (future == null) {
            return;
        }

        if (event.getState() == EventState.NO_ROUTE) {
            future.complete(ProxyResponse.notRouted());
            return;
        }

        if (event.shouldSkip() || event.getState() != EventState.ADMISSION_PENDING) {
            completeWithError(event, future);
            return;
        }

        dispatch(event, future);
    }

    private void dispatch(GatewayRequestEvent event, CompletableFuture<ProxyResponse> future) {
        ProxyRequest request = event.getRequest();
        RouteConfig route = event.getRoute();
        String requestId = event.getRequestId();
        long acceptedAtNanos = event.getAcceptedAtNanos();
        CompletableFuture<Void> admission = event.getAdmission();
        event.markDispatched();

        admission
                .handle((admitted, error) -> error)
                .thenCompose(rejection -> {
                    if (rejection != null) {
                        log.warn("Request rejected by rate limiter: requestId={}, route={}, error={}",
                                requestId, route.key(), GatewayErrors.unwrap(rejection).getMessage());
                        return CompletableFuture.completedFuture(
                                GatewayErrors.toResponse(rejection, requestId, null, 0));
                    }
                    try {
                        return proxyExecutor.execute(request, route, requestId);
                    } catch (RuntimeException e) {
                        log.error("Proxy dispatch failed: requestId={}, route={}", requestId, route.key(), e);
                        return CompletableFuture.completedFuture(GatewayErrors.toResponse(e, requestId, null, 0));
                    }
                })
                .whenComplete((response, error) -> {
                    ProxyResponse result = error == null
                            ? response
                            : GatewayErrors.toResponse(error, requestId, null, 0);
                    publish(request, route, requestId, acceptedAtNanos, result);
                    future.complete(result);
                });
    }

    private void completeWithError(GatewayRequestEvent event, CompletableFuture<ProxyResponse> future) {
        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        String message = event.getErrorMessage() != null
                ? event.getErrorMessage()
                : "Invalid state for dispatch: " + event.getState();

        log.warn("Completing request with pre-dispatch error: requestId={}, errorType={}, error={}",
                event.getRequestId(), errorType, message);

        ProxyResponse response = GatewayErrors.toResponse(errorType, "Internal Server Error",
                event.getRequestId(), null, 0);
        if (event.getRoute() != null) {
            publish(event.getRequest(), event.getRoute(), event.getRequestId(), event.getAcceptedAtNanos(), response);
        }
        future.complete(response);
    }

    private void publish(ProxyRequest request, RouteConfig route, String requestId,
                         long acceptedAtNanos, ProxyResponse response) {
        try {
            recordSink.accept(new RequestRecord(
                    requestId,
                    request.method(),
                    request.path(),
                    route.getServiceName(),
                    response.instanceId(),
                    response.statusCode(),
                    Duration.ofNanos(System.nanoTime() - acceptedAtNanos).toMillis(),
                    response.errorType(),
                    Instant.now()
            ));
        } catch (RuntimeException e) {
            log.error("Error publishing request record: requestId={}", requestId, e);
        }
    }
}
