package me.internalizable.orchestra.hub.status;

import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.SystemOverview;
import me.internalizable.orchestra.hub.registry.ServerRegistry;
import me.internalizable.orchestra.hub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusAggregatorTest {

    private MutableClock clock;
    private ServerRegistry registry;
    private StatusAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ServerRegistry();
        aggregator = new StatusAggregator(registry, clock);
    }

    @Test
    void overviewCountsByStatus() {
        register("a", ServerStatus.RUNNING);
        register("b", ServerStatus.RUNNING);
        register("c", ServerStatus.ERROR);
        register("d", ServerStatus.STARTING);

        SystemOverview overview = aggregator.getSystemOverview();

        assertThat(overview.timestamp()).isEqualTo(clock.instant());
        assertThat(overview.totalServers()).isEqualTo(4);
        assertThat(overview.healthyServers()).isEqualTo(2);
        assertThat(overview.unhealthyServers()).isEqualTo(2);
        assertThat(overview.serversByStatus())
                .containsEntry(ServerStatus.RUNNING, 2)
                .containsEntry(ServerStatus.ERROR, 1)
                .containsEntry(ServerStatus.STARTING, 1)
                .doesNotContainKey(ServerStatus.STOPPED);
        assertThat(overview.systemMetrics().availableProcessors()).isPositive();
        assertThat(overview.systemMetrics().javaVersion()).isNotBlank();
    }

    @Test
    void emptyRegistryGivesEmptyOverview() {
        SystemOverview overview = aggregator.getSystemOverview();

        assertThat(overview.totalServers()).isZero();
        assertThat(overview.healthyServers()).isZero();
        assertThat(overview.serversByStatus()).isEmpty();
    }

    @Test
    void lookupsReturnSnapshots() {
        ServerRecord record = register("a", ServerStatus.RUNNING);

        assertThat(aggregator.getServer("a")).contains(record);
        assertThat(aggregator.getServer("missing")).isEmpty();
        assertThat(aggregator.getAllServers()).containsExactly(record);
    }

    private ServerRecord register(String id, ServerStatus status) {
        ServerConfig config = ServerConfig.builder(id).type("fake").port(9000).build();
        ServerRecord record = ServerRecord.starting(config, clock.instant(), null)
                .withStatus(status, clock.instant());
        registry.register(record);
        return record;
    }
}
