package fr.lapetina.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.gateway.domain.event.EventState;
import fr.lapetina.gateway.domain.event.GatewayRequestEvent;
import fr.lapetina.gateway.domain.model.ErrorType;
import fr.lapetina.gateway.domain.model.RateLimitRule;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Second stage handler: asks the rate limiter to admit routed requests.
 *
 * Admission is asynchronous. A queued request leaves this stage with a
 * pending admission future so the handler thread never waits on the queue.
 * Limiter keys are scoped per route as {@code METHOD:path:<resolved key>}.
 */
public final class AdmissionHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    private static final CompletableFuture<Void> ADMITTED = CompletableFuture.completedFuture(null);

    private final RateLimiter rateLimiter;

    public AdmissionHandler(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.ROUTED) {
            return;
        }

        RouteConfig route = event.getRoute();
        Optional<RateLimitRule> rule = route.getRateLimit();
        if (rule.isEmpty()) {
            event.setAdmission(ADMITTED);
            return;
        }

        try {
            String key = route.key() + ":" + rule.get().keyResolver().apply(event.getRequest());
            event.setAdmission(rateLimiter.acquire(key, rule.get()));
        } catch (RuntimeException e) {
            log.error("Rate limit check failed: requestId={}, route={}", event.getRequestId(), route.key(), e);
            event.markFailed(ErrorType.INTERNAL_ERROR, "Rate limit check failed: " + e.getMessage());
        }
    }
}
