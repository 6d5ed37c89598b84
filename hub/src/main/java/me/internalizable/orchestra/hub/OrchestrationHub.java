package me.internalizable.orchestra.hub;

import me.internalizable.orchestra.api.hub.OperationResult;
import me.internalizable.orchestra.api.hub.OrchestrationHubAPI;
import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatusListener;
import me.internalizable.orchestra.api.hub.SystemOverview;
import me.internalizable.orchestra.api.hub.adapter.RecoveryStrategy;
import me.internalizable.orchestra.hub.adapter.AdapterRegistry;
import me.internalizable.orchestra.hub.config.HubConfig;
import me.internalizable.orchestra.hub.health.HealthScheduler;
import me.internalizable.orchestra.hub.lifecycle.LifecycleController;
import me.internalizable.orchestra.hub.registry.ServerRegistry;
import me.internalizable.orchestra.hub.status.StatusAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the orchestration hub.
 *
 * <p>Wires the registry, lifecycle controller, health scheduler and status
 * aggregator together and exposes them through {@link OrchestrationHubAPI}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AdapterRegistry adapters = new AdapterRegistry()
 *     .register(new ProcessAdapterFactory());
 *
 * OrchestrationHub hub = OrchestrationHub.fromConfig(OrchestrationHub.DEFAULT_CONFIG_PATH, adapters);
 * hub.initialize();
 *
 * hub.startServer(ServerConfig.builder("worker")
 *     .type("process")
 *     .port(9100)
 *     .metadata("command", "./worker.sh")
 *     .build()).join();
 *
 * hub.shutdown();
 * }</pre>
 */
public class OrchestrationHub implements OrchestrationHubAPI {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrchestrationHub.class);

    public static final Path DEFAULT_CONFIG_PATH = Paths.get("hub", "config.yml");

    private final HubConfig config;
    private final AdapterRegistry adapterRegistry;
    private final Clock clock;

    private final ServerRegistry registry;
    private final LifecycleController lifecycleController;
    private final HealthScheduler healthScheduler;
    private final StatusAggregator statusAggregator;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a hub.
     *
     * @param config hub configuration
     * @param adapterRegistry adapter factories by server type
     * @param recoveryStrategy strategy for servers in ERROR, or null for none
     * @param clock clock for record timestamps and the startup timeout
     * @throws IllegalArgumentException if a timing value in the configuration is not positive
     */
    public OrchestrationHub(
            @Nonnull HubConfig config,
            @Nonnull AdapterRegistry adapterRegistry,
            @Nullable RecoveryStrategy recoveryStrategy,
            @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.adapterRegistry = Objects.requireNonNull(adapterRegistry, "adapterRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
        config.validate();

        this.registry = new ServerRegistry();
        this.lifecycleController = new LifecycleController(registry, adapterRegistry, config, clock);
        this.healthScheduler = new HealthScheduler(
                registry, lifecycleController::getAdapter, config, clock, recoveryStrategy);
        this.statusAggregator = new StatusAggregator(registry, clock);
    }

    public OrchestrationHub(@Nonnull HubConfig config, @Nonnull AdapterRegistry adapterRegistry) {
        this(config, adapterRegistry, null, Clock.systemUTC());
    }

    /**
     * Create a hub from a configuration file, writing defaults if it is missing.
     *
     * @param configPath path to the YAML configuration
     * @param adapterRegistry adapter factories by server type
     * @return the hub, not yet initialized
     * @throws IOException if the configuration cannot be read or written
     */
    @Nonnull
    public static OrchestrationHub fromConfig(
            @Nonnull Path configPath,
            @Nonnull AdapterRegistry adapterRegistry) throws IOException {
        HubConfig config = HubConfig.load(configPath);
        LOGGER.info("Loaded hub configuration from {}", configPath);
        return new OrchestrationHub(config, adapterRegistry);
    }

    // ==================== Initialization ====================

    /**
     * Start health checking and the enabled configured servers.
     */
    public void initialize() {
        if (initialized) {
            throw new IllegalStateException("Orchestration hub already initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("Orchestration hub already shut down");
        }

        LOGGER.info("Initializing orchestration hub...");
        healthScheduler.start();
        initialized = true;

        startConfiguredServers();

        LOGGER.info("Orchestration hub initialized");
        LOGGER.info("  Adapter types: {}", adapterRegistry.getTypes());
        LOGGER.info("  Configured servers: {}", config.getServers().size());
    }

    private void startConfiguredServers() {
        for (ServerConfig serverConfig : config.getServerConfigs()) {
            String serverId = serverConfig.id();
            if (!serverConfig.enabled()) {
                LOGGER.info("Server '{}' configured but not enabled", serverId);
                continue;
            }

            LOGGER.info("Auto-starting server: {}", serverId);
            lifecycleController.start(serverConfig).whenComplete((result, error) -> {
                if (error != null) {
                    LOGGER.error("Failed to start server '{}': {}", serverId, error.getMessage());
                } else if (!result.isCompleted()) {
                    LOGGER.error("Failed to start server '{}': {}", serverId, result.getMessage());
                }
            });
        }
    }

    // ==================== Operations ====================

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> startServer(@Nonnull ServerConfig serverConfig) {
        checkInitialized();
        return lifecycleController.start(serverConfig);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> stopServer(@Nonnull String serverId) {
        checkInitialized();
        return lifecycleController.stop(serverId);
    }

    @Override
    @Nonnull
    public CompletableFuture<OperationResult> restartServer(@Nonnull String serverId) {
        checkInitialized();
        return lifecycleController.restart(serverId);
    }

    // ==================== Queries ====================

    @Override
    @Nonnull
    public Optional<ServerRecord> getServer(@Nonnull String serverId) {
        checkInitialized();
        return statusAggregator.getServer(serverId);
    }

    @Override
    @Nonnull
    public List<ServerRecord> getAllServers() {
        checkInitialized();
        return statusAggregator.getAllServers();
    }

    @Override
    @Nonnull
    public SystemOverview getSystemOverview() {
        checkInitialized();
        return statusAggregator.getSystemOverview();
    }

    @Override
    public void addStatusListener(@Nonnull ServerStatusListener listener) {
        registry.addListener(listener);
    }

    @Override
    public void removeStatusListener(@Nonnull ServerStatusListener listener) {
        registry.removeListener(listener);
    }

    // ==================== Components ====================

    @Nonnull
    public HubConfig getConfig() {
        return config;
    }

    @Nonnull
    public AdapterRegistry getAdapterRegistry() {
        return adapterRegistry;
    }

    @Nonnull
    public ServerRegistry getRegistry() {
        return registry;
    }

    @Nonnull
    public LifecycleController getLifecycleController() {
        return lifecycleController;
    }

    @Nonnull
    public HealthScheduler getHealthScheduler() {
        return healthScheduler;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Orchestration hub not initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("Orchestration hub shut down");
        }
    }

    /**
     * Stop every server, then release the hub's threads.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down orchestration hub...");

        healthScheduler.shutdown();
        lifecycleController.stopAll(config.getHubShutdownTimeout());
        lifecycleController.shutdown();
        registry.clear();

        LOGGER.info("Orchestration hub shut down");
    }
}
