package me.internalizable.orchestra.hub.registry;

import me.internalizable.orchestra.api.hub.HealthMetrics;
import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.ServerStatusChangeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerRegistryTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private ServerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ServerRegistry();
    }

    @Test
    void registerKeepsFirstRecordPerId() {
        ServerRecord first = starting("echo");
        ServerRecord second = starting("echo");

        assertThat(registry.register(first)).isNull();
        assertThat(registry.register(second)).isSameAs(first);
        assertThat(registry.getServerCount()).isEqualTo(1);
        assertThat(registry.getServer("echo")).isSameAs(first);
    }

    @Test
    void replaceOnlySucceedsAgainstCurrentRecord() {
        ServerRecord starting = starting("echo");
        registry.register(starting);
        ServerRecord running = starting.running(NOW.plusSeconds(1));

        assertThat(registry.replace(starting, running)).isTrue();
        assertThat(registry.replace(starting, starting.withError("late", NOW))).isFalse();
        assertThat(registry.getServer("echo")).isSameAs(running);
    }

    @Test
    void replaceRejectsDifferentIds() {
        ServerRecord echo = starting("echo");
        registry.register(echo);

        assertThatThrownBy(() -> registry.replace(echo, starting("other")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void allServersFollowRegistrationOrder() {
        registry.register(starting("c"));
        registry.register(starting("a"));
        registry.register(starting("b"));

        assertThat(registry.getAllServers())
                .extracting(ServerRecord::getId)
                .containsExactly("c", "a", "b");
    }

    @Test
    void listenersSeeStatusChangesOnly() {
        List<ServerStatusChangeEvent> events = new ArrayList<>();
        registry.addListener(events::add);

        ServerRecord starting = starting("echo");
        registry.register(starting);
        ServerRecord running = starting.running(NOW);
        registry.replace(starting, running);
        registry.replace(running, running.withHealthCheck(HealthMetrics.EMPTY, NOW.plusSeconds(30)));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).getPrevious()).isNull();
        assertThat(events.get(0).getNewStatus()).isEqualTo(ServerStatus.STARTING);
        assertThat(events.get(1).getPreviousStatus()).isEqualTo(ServerStatus.STARTING);
        assertThat(events.get(1).getNewStatus()).isEqualTo(ServerStatus.RUNNING);
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<ServerStatus> seen = new ArrayList<>();
        registry.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        registry.addListener(event -> seen.add(event.getNewStatus()));

        ServerRecord starting = starting("echo");
        registry.register(starting);
        assertThat(registry.replace(starting, starting.running(NOW))).isTrue();

        assertThat(seen).containsExactly(ServerStatus.STARTING, ServerStatus.RUNNING);
    }

    @Test
    void awaitStatusCompletesOnMatchingTransition() {
        ServerRecord starting = starting("echo");
        registry.register(starting);

        CompletableFuture<ServerRecord> settled = registry.awaitStatus("echo", s -> s != ServerStatus.STARTING);
        assertThat(settled).isNotDone();

        ServerRecord running = starting.running(NOW);
        registry.replace(starting, running);

        assertThat(settled).isCompletedWithValue(running);
    }

    @Test
    void awaitStatusCompletesImmediatelyWhenAlreadyMatching() {
        ServerRecord starting = starting("echo");
        registry.register(starting);

        assertThat(registry.awaitStatus("echo", s -> s == ServerStatus.STARTING))
                .isCompletedWithValue(starting);
        assertThat(registry.awaitStatus("ghost", s -> true)).isCompletedWithValue(null);
    }

    @Test
    void clearReleasesWaiters() {
        registry.register(starting("echo"));
        CompletableFuture<ServerRecord> waiter = registry.awaitStatus("echo", s -> s == ServerStatus.RUNNING);

        registry.clear();

        assertThat(waiter).isCompletedWithValue(null);
        assertThat(registry.getAllServers()).isEmpty();
    }

    private static ServerRecord starting(String id) {
        ServerConfig config = ServerConfig.builder(id).type("fake").port(9000).build();
        return ServerRecord.starting(config, NOW, null);
    }
}
