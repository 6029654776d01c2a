/**
 * LMAX Disruptor pipeline carrying proxied requests through the gateway.
 *
 * <p>Each request is published into a pre-allocated ring buffer and passes the
 * handlers in order:
 * <pre>
 * Route Match → Admission (rate limit) → Dispatch → Completion
 * </pre>
 *
 * <p>Handlers never block on downstream I/O. Dispatch hands the call to the
 * proxy executor and completion is driven by the returned future, so a handler
 * must copy what it needs off the event before the slot is reused.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.disruptor.GatewayPipeline} - Pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.gateway.disruptor.exception.BackpressureException} - Thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.gateway.disruptor;
