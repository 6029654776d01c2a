/**
 * Configuration loading and validation.
 *
 * <p>This package parses the YAML configuration into a JavaBean tree and validates it
 * before any component is built from it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.infrastructure.config.GatewayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.gateway.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Inbound HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code strategy} - Load balancing strategy selection</li>
 *   <li>{@code circuitBreaker} - Defaults for proxy circuit breakers</li>
 *   <li>{@code healthCheck} - Probe interval, timeout and probe breaker settings</li>
 *   <li>{@code rateLimit} - Limiter housekeeping</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code timeouts} - Connect and default route timeouts</li>
 *   <li>{@code lifecycle} - Service Manager startup polling</li>
 *   <li>{@code metrics} - Prometheus metric name prefix</li>
 *   <li>{@code services} and {@code routes} - Managed services and gateway routes</li>
 * </ul>
 *
 * @see fr.lapetina.gateway.infrastructure.config.GatewayConfig
 */
package fr.lapetina.gateway.infrastructure.config;
