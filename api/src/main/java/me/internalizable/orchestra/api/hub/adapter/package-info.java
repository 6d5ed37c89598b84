/**
 * Contract implemented by managed-server adapters.
 *
 * <p>The hub never knows what a managed server does. It only drives the
 * adapter's start, stop and probe operations.</p>
 */
package me.internalizable.orchestra.api.hub.adapter;
