package me.internalizable.orchestra.api.hub;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

    @Test
    void builderDefaultsToEnabled() {
        ServerConfig config = ServerConfig.builder("echo")
                .type("process")
                .port(9000)
                .metadata("command", "sleep 60")
                .build();

        assertThat(config.enabled()).isTrue();
        assertThat(config.getMetadataString("command")).isEqualTo("sleep 60");
        assertThat(config.getMetadata("missing")).isNull();
    }

    @Test
    void metadataIsCopiedAndUnmodifiable() {
        Map<String, Object> source = new HashMap<>();
        source.put("command", "sleep 60");
        ServerConfig config = new ServerConfig("echo", "process", 9000, true, source);

        source.put("command", "rm -rf /");

        assertThat(config.getMetadataString("command")).isEqualTo("sleep 60");
        assertThatThrownBy(() -> config.metadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(new ServerConfig("echo", "process", 9000, true, null).metadata()).isEmpty();
    }

    @Test
    void statusGroups() {
        assertThat(ServerStatus.STOPPED.isResting()).isTrue();
        assertThat(ServerStatus.TIMEOUT.isResting()).isTrue();
        assertThat(ServerStatus.NOT_RESPONDING.isResting()).isFalse();
        assertThat(ServerStatus.STOPPING.isTransitioning()).isTrue();
        assertThat(ServerStatus.DEGRADED.isHealthy()).isFalse();
    }
}
