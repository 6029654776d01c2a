/**
 * Load balancing strategies.
 *
 * <p>Strategies pick one instance among the healthy candidates returned by
 * the registry. Per-service state (round-robin counters) lives inside the
 * strategy; rolling metrics are read through {@link fr.lapetina.gateway.domain.strategy.MetricsLookup}.
 *
 * <ul>
 *   <li>{@code round-robin} - per-service counter modulo candidate count</li>
 *   <li>{@code least-connections} - fewest active connections</li>
 *   <li>{@code weighted-round-robin} - counter modulo total weight</li>
 *   <li>{@code random} - uniform random</li>
 *   <li>{@code health-based} - best latency/error/load score (default)</li>
 * </ul>
 *
 * @see fr.lapetina.gateway.domain.strategy.StrategyFactory
 */
package fr.lapetina.gateway.domain.strategy;
