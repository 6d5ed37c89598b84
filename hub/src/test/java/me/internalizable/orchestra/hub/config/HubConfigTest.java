package me.internalizable.orchestra.hub.config;

import me.internalizable.orchestra.api.hub.ServerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HubConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        Path path = tempDir.resolve("hub").resolve("config.yml");

        HubConfig config = HubConfig.load(path);

        assertThat(path).exists();
        assertThat(config.getHealthCheckInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getStartupTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getGracefulShutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getForcedShutdownTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getProbeTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getServers()).isEmpty();

        String written = Files.readString(path);
        assertThat(written).contains("healthCheckIntervalSeconds: 30").doesNotContain("!!");
    }

    @Test
    void serversAreReadInFileOrder() throws Exception {
        Path path = tempDir.resolve("config.yml");
        Files.writeString(path, String.join("\n",
                "healthCheckIntervalSeconds: 15",
                "startupTimeoutSeconds: 120",
                "servers:",
                "  search:",
                "    type: process",
                "    port: 9200",
                "    metadata:",
                "      command: ./search.sh",
                "      readyLine: started",
                "  cache:",
                "    type: process",
                "    port: 6379",
                "    enabled: false",
                "    metadata:",
                "      command: [redis-server, --port, '6379']",
                ""));

        HubConfig config = HubConfig.load(path);
        List<ServerConfig> servers = config.getServerConfigs();

        assertThat(config.getHealthCheckIntervalSeconds()).isEqualTo(15);
        assertThat(config.getStartupTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(servers).extracting(ServerConfig::id).containsExactly("search", "cache");

        ServerConfig search = servers.get(0);
        assertThat(search.type()).isEqualTo("process");
        assertThat(search.port()).isEqualTo(9200);
        assertThat(search.enabled()).isTrue();
        assertThat(search.getMetadataString("readyLine")).isEqualTo("started");

        ServerConfig cache = servers.get(1);
        assertThat(cache.enabled()).isFalse();
        assertThat(cache.getMetadata("command")).isEqualTo(List.of("redis-server", "--port", "6379"));
    }

    @Test
    void savedConfigLoadsBack() throws Exception {
        Path path = tempDir.resolve("config.yml");
        HubConfig original = new HubConfig();
        original.setProbeTimeoutSeconds(2);
        HubConfig.ServerDefinition definition = new HubConfig.ServerDefinition();
        definition.setType("process");
        definition.setPort(9000);
        original.getServers().put("echo", definition);
        original.save(path);

        HubConfig loaded = HubConfig.load(path);

        assertThat(loaded.getProbeTimeoutSeconds()).isEqualTo(2);
        assertThat(loaded.getServerConfigs()).extracting(ServerConfig::id).containsExactly("echo");
    }

    @Test
    void nonPositiveTimingsAreRejected() throws Exception {
        Path zeroInterval = tempDir.resolve("zero.yml");
        Files.writeString(zeroInterval, "healthCheckIntervalSeconds: 0\n");
        Path negativeTimeout = tempDir.resolve("negative.yml");
        Files.writeString(negativeTimeout, "probeTimeoutSeconds: -5\n");

        assertThatThrownBy(() -> HubConfig.load(zeroInterval))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("healthCheckIntervalSeconds must be positive, got 0");
        assertThatThrownBy(() -> HubConfig.load(negativeTimeout))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("probeTimeoutSeconds must be positive, got -5");
    }

    @Test
    void emptyServersSectionLoadsAsNoServers() throws Exception {
        Path path = tempDir.resolve("config.yml");
        Files.writeString(path, "servers:\n");

        assertThat(HubConfig.load(path).getServerConfigs()).isEmpty();
    }

    @Test
    void foreignGlobalTagsAreRejected() throws Exception {
        Path path = tempDir.resolve("config.yml");
        Files.writeString(path, "servers: !!java.util.ArrayList []\n");

        assertThatThrownBy(() -> HubConfig.load(path)).isInstanceOf(RuntimeException.class);
    }
}
