package me.internalizable.orchestra.hub.status;

import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.SystemOverview;
import me.internalizable.orchestra.hub.registry.ServerRegistry;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only views over the registry.
 *
 * <p>Each call reads the registry once; the overview is consistent per
 * record but not across records taken at slightly different moments.</p>
 */
public class StatusAggregator {

    private final ServerRegistry registry;
    private final Clock clock;

    public StatusAggregator(@Nonnull ServerRegistry registry, @Nonnull Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Nonnull
    public Optional<ServerRecord> getServer(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return Optional.ofNullable(registry.getServer(serverId));
    }

    @Nonnull
    public List<ServerRecord> getAllServers() {
        return registry.getAllServers();
    }

    /**
     * Count servers by status and sample the hub's own runtime.
     *
     * @return the overview
     */
    @Nonnull
    public SystemOverview getSystemOverview() {
        List<ServerRecord> records = registry.getAllServers();

        Map<ServerStatus, Integer> byStatus = new EnumMap<>(ServerStatus.class);
        int healthy = 0;
        for (ServerRecord record : records) {
            byStatus.merge(record.status(), 1, Integer::sum);
            if (record.status().isHealthy()) {
                healthy++;
            }
        }

        int total = records.size();
        return new SystemOverview(
                clock.instant(),
                total,
                healthy,
                total - healthy,
                byStatus,
                sampleRuntime()
        );
    }

    private static SystemOverview.SystemMetrics sampleRuntime() {
        Runtime runtime = Runtime.getRuntime();
        return new SystemOverview.SystemMetrics(
                runtime.availableProcessors(),
                runtime.totalMemory(),
                runtime.freeMemory(),
                runtime.maxMemory(),
                System.getProperty("java.version")
        );
    }
}
