package me.internalizable.orchestra.api.hub;

/**
 * Advisory health metrics reported by a server probe.
 *
 * @param cpuUsage CPU usage in percent
 * @param memoryUsage used memory in bytes
 * @param memoryTotal available memory in bytes
 * @param activeConnections currently open connections
 * @param requestCount requests served since start
 * @param errorCount failed requests since start
 * @param responseTimeMs mean response time in milliseconds
 */
public record HealthMetrics(
        double cpuUsage,
        long memoryUsage,
        long memoryTotal,
        int activeConnections,
        long requestCount,
        long errorCount,
        double responseTimeMs
) {

    /**
     * Metrics for a probe that reported nothing beyond liveness.
     */
    public static final HealthMetrics EMPTY = new HealthMetrics(0.0, 0L, 0L, 0, 0L, 0L, 0.0);

    /**
     * Get memory usage relative to the available memory.
     *
     * @return usage in percent, or 0 if the total is unknown
     */
    public double getMemoryUsagePercentage() {
        return memoryTotal > 0 ? (double) memoryUsage / memoryTotal * 100.0 : 0.0;
    }

    /**
     * Get the share of failed requests.
     *
     * @return error rate in percent, or 0 if no requests were served
     */
    public double getErrorRate() {
        return requestCount > 0 ? (double) errorCount / requestCount * 100.0 : 0.0;
    }
}
