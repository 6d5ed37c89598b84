package me.internalizable.orchestra.hub.config;

import me.internalizable.orchestra.api.hub.ServerConfig;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the orchestration hub.
 *
 * <p>Loaded from {@code hub/config.yml} and defines timing parameters and
 * the servers the hub knows about at startup.</p>
 */
public class HubConfig {

    private int healthCheckIntervalSeconds = 30;
    private int startupTimeoutSeconds = 60;
    private int gracefulShutdownTimeoutSeconds = 10;
    private int forcedShutdownTimeoutSeconds = 5;
    private int probeTimeoutSeconds = 5;
    private int hubShutdownTimeoutSeconds = 60;
    private Map<String, ServerDefinition> servers = new LinkedHashMap<>();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     * @throws IllegalArgumentException if a timing value is not positive
     */
    @Nonnull
    public static HubConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            HubConfig config = new HubConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        options.setTagInspector(tag -> tag.getClassName().startsWith(HubConfig.class.getPackageName()));
        Yaml yaml = new Yaml(new Constructor(HubConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            HubConfig config = yaml.load(is);
            if (config == null) {
                return new HubConfig();
            }
            if (config.servers == null) {
                config.servers = new LinkedHashMap<>();
            }
            config.validate();
            return config;
        }
    }

    /**
     * Check that every timing value is positive.
     *
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public void validate() {
        requirePositive("healthCheckIntervalSeconds", healthCheckIntervalSeconds);
        requirePositive("startupTimeoutSeconds", startupTimeoutSeconds);
        requirePositive("gracefulShutdownTimeoutSeconds", gracefulShutdownTimeoutSeconds);
        requirePositive("forcedShutdownTimeoutSeconds", forcedShutdownTimeoutSeconds);
        requirePositive("probeTimeoutSeconds", probeTimeoutSeconds);
        requirePositive("hubShutdownTimeoutSeconds", hubShutdownTimeoutSeconds);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    /**
     * Build the configured servers.
     *
     * @return server configurations keyed by ID, in file order
     */
    @Nonnull
    public List<ServerConfig> getServerConfigs() {
        List<ServerConfig> configs = new ArrayList<>();
        for (Map.Entry<String, ServerDefinition> entry : servers.entrySet()) {
            configs.add(entry.getValue().toServerConfig(entry.getKey()));
        }
        return configs;
    }

    public Duration getHealthCheckInterval() {
        return Duration.ofSeconds(healthCheckIntervalSeconds);
    }

    public Duration getStartupTimeout() {
        return Duration.ofSeconds(startupTimeoutSeconds);
    }

    public Duration getGracefulShutdownTimeout() {
        return Duration.ofSeconds(gracefulShutdownTimeoutSeconds);
    }

    public Duration getForcedShutdownTimeout() {
        return Duration.ofSeconds(forcedShutdownTimeoutSeconds);
    }

    public Duration getProbeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    public Duration getHubShutdownTimeout() {
        return Duration.ofSeconds(hubShutdownTimeoutSeconds);
    }

    // Getters and Setters

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    }

    public int getStartupTimeoutSeconds() {
        return startupTimeoutSeconds;
    }

    public void setStartupTimeoutSeconds(int startupTimeoutSeconds) {
        this.startupTimeoutSeconds = startupTimeoutSeconds;
    }

    public int getGracefulShutdownTimeoutSeconds() {
        return gracefulShutdownTimeoutSeconds;
    }

    public void setGracefulShutdownTimeoutSeconds(int gracefulShutdownTimeoutSeconds) {
        this.gracefulShutdownTimeoutSeconds = gracefulShutdownTimeoutSeconds;
    }

    public int getForcedShutdownTimeoutSeconds() {
        return forcedShutdownTimeoutSeconds;
    }

    public void setForcedShutdownTimeoutSeconds(int forcedShutdownTimeoutSeconds) {
        this.forcedShutdownTimeoutSeconds = forcedShutdownTimeoutSeconds;
    }

    public int getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
        this.probeTimeoutSeconds = probeTimeoutSeconds;
    }

    public int getHubShutdownTimeoutSeconds() {
        return hubShutdownTimeoutSeconds;
    }

    public void setHubShutdownTimeoutSeconds(int hubShutdownTimeoutSeconds) {
        this.hubShutdownTimeoutSeconds = hubShutdownTimeoutSeconds;
    }

    public Map<String, ServerDefinition> getServers() {
        return servers;
    }

    public void setServers(Map<String, ServerDefinition> servers) {
        this.servers = servers;
    }

    /**
     * Configuration for a predefined managed server.
     */
    public static class ServerDefinition {
        private String type;
        private int port;
        private boolean enabled = true;
        private Map<String, Object> metadata = new HashMap<>();

        /**
         * Convert to an immutable server configuration.
         *
         * @param id server identifier (the key in the {@code servers} map)
         * @return server configuration
         */
        @Nonnull
        public ServerConfig toServerConfig(@Nonnull String id) {
            return new ServerConfig(id, type, port, enabled, metadata);
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }
    }
}
