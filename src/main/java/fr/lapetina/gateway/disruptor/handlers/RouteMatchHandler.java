package fr.lapetina.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.gateway.domain.event.EventState;
import fr.lapetina.gateway.domain.event.GatewayRequestEvent;
import fr.lapetina.gateway.domain.model.ProxyRequest;
import fr.lapetina.gateway.domain.model.RouteConfig;
import fr.lapetina.gateway.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * First stage handler: resolves the route for the inbound method and path.
 *
 * Unmatched requests are flagged NO_ROUTE and pass through the remaining
 * stages untouched.
 */
public final class RouteMatchHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RouteMatchHandler.class);

    private final RouteTable routeTable;

    public RouteMatchHandler(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.getState() != EventState.CREATED) {
            return;
        }

        ProxyRequest request = event.getRequest();
        Optional<RouteConfig> route = routeTable.find(request.method(), request.path());
        if (route.isEmpty()) {
            log.debug("No route matched: requestId={}, method={}, path={}",
                    event.getRequestId(), request.method(), request.path());
            event.markNoRoute();
            return;
        }

        event.markRouted(route.get());
        log.debug("Route matched: requestId={}, route={}, service={}",
                event.getRequestId(), route.get().key(), route.get().getServiceName());
    }
}
