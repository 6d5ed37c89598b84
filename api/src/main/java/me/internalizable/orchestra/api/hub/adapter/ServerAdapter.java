package me.internalizable.orchestra.api.hub.adapter;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Starts, stops and probes one managed server.
 *
 * <p>Each adapter instance belongs to exactly one server ID and is never
 * shared. A start that outlives the startup timeout is abandoned, not
 * interrupted, so {@link #doStop()} and {@link #forceStop()} may be called
 * while {@link #doStart()} is still running and must end that start.
 * {@link #probe(Duration)} may run while a stop is in progress.</p>
 *
 * <p>Before a server that timed out or failed is started again, the hub
 * calls {@link #forceStop()} on its previous adapter and only hands the ID
 * to a new adapter once that succeeded.</p>
 *
 * <p>Any method may block. Exceptions thrown by an adapter are treated as
 * failures with the exception message as reason.</p>
 */
public interface ServerAdapter {

    /**
     * Start the server and block until it is ready or has failed.
     *
     * @return success, or failure with a reason
     */
    @Nonnull
    AdapterResult doStart();

    /**
     * Request a graceful shutdown and block until it has completed.
     *
     * <p>The hub abandons the call after the grace period and escalates to
     * {@link #forceStop()}.</p>
     *
     * @return success, or failure with a reason
     */
    @Nonnull
    AdapterResult doStop();

    /**
     * Terminate the server immediately.
     *
     * @return success, or failure with a reason
     */
    @Nonnull
    AdapterResult forceStop();

    /**
     * Check whether the server is alive.
     *
     * @param timeout how long the probe may take before the hub abandons it
     * @return probe result
     */
    @Nonnull
    ProbeResult probe(@Nonnull Duration timeout);
}
