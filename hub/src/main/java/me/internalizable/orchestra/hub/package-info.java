/**
 * Orchestration hub for heterogeneous managed servers.
 *
 * <p>The hub starts, stops and health-checks servers through pluggable
 * adapters and keeps an immutable status record per server.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.orchestra.hub.OrchestrationHub} - Composition root and public API</li>
 *   <li>{@link me.internalizable.orchestra.hub.registry.ServerRegistry} - Status records and change notifications</li>
 *   <li>{@link me.internalizable.orchestra.hub.lifecycle.LifecycleController} - Start, stop and restart</li>
 *   <li>{@link me.internalizable.orchestra.hub.health.HealthScheduler} - Periodic probes and startup timeouts</li>
 *   <li>{@link me.internalizable.orchestra.hub.status.StatusAggregator} - Read-only views</li>
 *   <li>{@link me.internalizable.orchestra.hub.adapter.AdapterRegistry} - Adapter factories by server type</li>
 * </ul>
 *
 * @see me.internalizable.orchestra.hub.OrchestrationHub
 */
package me.internalizable.orchestra.hub;
