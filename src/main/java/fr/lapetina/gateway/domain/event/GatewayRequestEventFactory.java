package fr.lapetina.gateway.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating GatewayRequestEvent instances in the Disruptor ring buffer.
 *
 * Events are pre-allocated at startup and reused by clearing and re-initializing them.
 */
public final class GatewayRequestEventFactory implements EventFactory<GatewayRequestEvent> {

    @Override
    public GatewayRequestEvent newInstance() {
        return new GatewayRequestEvent();
    }
}
