package fr.lapetina.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.gateway.domain.event.GatewayRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: releases the ring buffer slot for reuse.
 *
 * Requests still in flight hold their own copies of the data they need,
 * so clearing here does not affect them.
 */
public final class CompletionHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            log.trace("Event released: sequence={}, event={}", sequence, event);
        } finally {
            event.clear();
        }
    }
}
