/**
 * API for the server orchestration hub.
 *
 * <p>Provides the contract callers use to start, stop and restart managed
 * servers, and the immutable data model they observe.</p>
 *
 * @see me.internalizable.orchestra.api.hub.OrchestrationHubAPI
 * @see me.internalizable.orchestra.api.hub.adapter.ServerAdapter
 */
package me.internalizable.orchestra.api.hub;
