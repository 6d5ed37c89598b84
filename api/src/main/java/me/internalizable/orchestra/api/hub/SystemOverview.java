package me.internalizable.orchestra.api.hub;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over all managed servers.
 *
 * <p>Descriptive only; nothing in the hub makes control decisions on it.</p>
 *
 * @param timestamp when the overview was taken
 * @param totalServers number of known servers
 * @param healthyServers number of RUNNING servers
 * @param unhealthyServers total minus healthy
 * @param serversByStatus count of servers per status
 * @param systemMetrics process-level metrics of the hub itself
 */
public record SystemOverview(
        Instant timestamp,
        int totalServers,
        int healthyServers,
        int unhealthyServers,
        Map<ServerStatus, Integer> serversByStatus,
        SystemMetrics systemMetrics
) {

    public SystemOverview {
        serversByStatus = Map.copyOf(serversByStatus);
    }

    /**
     * Process-level metrics of the hub.
     */
    public record SystemMetrics(
            int availableProcessors,
            long totalMemory,
            long freeMemory,
            long maxMemory,
            String javaVersion
    ) {}
}
