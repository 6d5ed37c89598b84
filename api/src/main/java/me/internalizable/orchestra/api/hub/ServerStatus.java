package me.internalizable.orchestra.api.hub;

/**
 * Represents the lifecycle status of a managed server.
 */
public enum ServerStatus {
    /**
     * Server is not running. Initial and final resting state.
     */
    STOPPED,

    /**
     * Adapter start has been requested and has not settled yet.
     */
    STARTING,

    /**
     * Server started and answers health probes.
     */
    RUNNING,

    /**
     * Graceful or forced termination is in progress.
     */
    STOPPING,

    /**
     * Server failed to start, failed to stop, or a health check raised an error.
     */
    ERROR,

    /**
     * Server is running but did not answer its last health probe.
     */
    NOT_RESPONDING,

    /**
     * Server stayed in {@link #STARTING} longer than the startup timeout.
     */
    TIMEOUT,

    /**
     * Server is running with reduced capability.
     */
    DEGRADED,

    /**
     * Server is intentionally out of rotation.
     */
    MAINTENANCE;

    /**
     * Check if the server is in a resting state.
     *
     * <p>A fresh start is only accepted from a resting state.</p>
     *
     * @return true for STOPPED, ERROR and TIMEOUT
     */
    public boolean isResting() {
        return this == STOPPED || this == ERROR || this == TIMEOUT;
    }

    /**
     * Check if a lifecycle transition is in flight.
     *
     * @return true for STARTING and STOPPING
     */
    public boolean isTransitioning() {
        return this == STARTING || this == STOPPING;
    }

    /**
     * Check if the server counts as healthy in aggregate views.
     *
     * @return true if running
     */
    public boolean isHealthy() {
        return this == RUNNING;
    }
}
