/**
 * Managed service lifecycle: dependency-ordered startup, health-gated
 * readiness and connection draining on shutdown.
 *
 * @see fr.lapetina.gateway.lifecycle.ServiceManager
 */
package fr.lapetina.gateway.lifecycle;
