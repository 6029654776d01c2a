/**
 * Domain model classes shared by the registry, balancer, limiter and gateway.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.domain.model.ServiceInstance} - Thread-safe registered backend instance</li>
 *   <li>{@link fr.lapetina.gateway.domain.model.InstanceMetrics} - Rolling latency/error/connection metrics</li>
 *   <li>{@link fr.lapetina.gateway.domain.model.RouteConfig} - Gateway route definition</li>
 *   <li>{@link fr.lapetina.gateway.domain.model.ProxyRequest} / {@link fr.lapetina.gateway.domain.model.ProxyResponse} - Immutable request and response</li>
 *   <li>{@link fr.lapetina.gateway.domain.model.ErrorType} - Categorized error types for responses</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code ServiceInstance} keeps its status in an
 * {@code AtomicReference}; {@code InstanceMetrics} guards its moving averages
 * with the instance lock.
 */
package fr.lapetina.gateway.domain.model;
