/**
 * Resilient Gateway - service registry, health checking, load balancing and
 * rate limiting behind a single HTTP entry point.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.GatewayFactory} - Wires every component from YAML configuration</li>
 *   <li>{@link fr.lapetina.gateway.GatewayApplication} - Standalone HTTP server with proxy, health,
 *       metrics and admin endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     factory.getServiceManager().registerService(definition);
 *     factory.getServiceManager().startAllServices().join();
 *
 *     ProxyResponse response = factory.getGateway().handle(request).join();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Pluggable load balancing strategies (round-robin, weighted, least-connections, random, health-based)</li>
 *   <li>Per-instance circuit breakers with call timeouts</li>
 *   <li>Fixed-window rate limiting with bounded wait queues</li>
 *   <li>Dependency-ordered service startup and draining shutdown</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.gateway.GatewayFactory
 * @see fr.lapetina.gateway.routing.ApiGateway
 */
package fr.lapetina.gateway;
