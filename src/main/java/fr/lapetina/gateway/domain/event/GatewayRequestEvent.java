package fr.lapetina.gateway.domain.event;

import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.ProxyResponse;
import fr.lapetina.gateway.domain.model.RouteConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: the event is cleared as soon as the last handler has seen it.
 * Asynchronous continuations must copy what they need off the event first.
 */
public final class GatewayRequestEvent {

    private ProxyRequest request;
    private String requestId;
    private long acceptedAtNanos;

    private EventState state;
    private RouteConfig route;
    private CompletableFuture<Void> admission;
    private ErrorType errorType;
    private String errorMessage;

    private CompletableFuture<ProxyResponse> responseFuture;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.requestId = null;
        this.acceptedAtNanos = 0;
        this.state = null;
        this.route = null;
        this.admission = null;
        this.errorType = null;
        this.errorMessage = null;
        this.responseFuture = null;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(
            ProxyRequest request,
            String requestId,
            CompletableFuture<ProxyResponse> responseFuture
    ) {
        clear();
        this.request = request;
        this.requestId = requestId;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAtNanos = System.nanoTime();
    }

    public ProxyRequest getRequest() {
        return request;
    }

    public String getRequestId() {
        return requestId;
    }

    public long getAcceptedAtNanos() {
        return acceptedAtNanos;
    }

    public EventState getState() {
        return state;
    }

    public RouteConfig getRoute() {
        return route;
    }

    public CompletableFuture<Void> getAdmission() {
        return admission;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public CompletableFuture<ProxyResponse> getResponseFuture() {
        return responseFuture;
    }

    public void markRouted(RouteConfig route) {
        this.route = route;
        this.state = EventState.ROUTED;
    }

    public void markNoRoute() {
        this.state = EventState.NO_ROUTE;
    }

    public void setAdmission(CompletableFuture<Void> admission) {
        this.admission = admission;
        this.state = EventState.ADMISSION_PENDING;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
    }

    public void markFailed(ErrorType errorType, String message) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * Checks if the remaining handlers should leave the event alone.
     */
    public boolean shouldSkip() {
        return state == EventState.NO_ROUTE || state == EventState.FAILED;
    }

    @Override
    public String toString() {
        return "GatewayRequestEvent{" +
                "requestId=" + requestId +
                ", method=" + (request != null ? request.method() : "null") +
                ", path=" + (request != null ? request.path() : "null") +
                ", state=" + state +
                ", route=" + (route != null ? route.key() : "null") +
                '}';
    }
}
