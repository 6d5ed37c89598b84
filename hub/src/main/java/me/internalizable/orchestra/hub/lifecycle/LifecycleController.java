package me.internalizable.orchestra.hub.lifecycle;

import me.internalizable.orchestra.api.hub.OperationResult;
import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.adapter.AdapterResult;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import me.internalizable.orchestra.hub.adapter.AdapterRegistry;
import me.internalizable.orchestra.hub.config.HubConfig;
import me.internalizable.orchestra.hub.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives server state transitions.
 *
 * <p>Operations on the same server are serialized by compare-and-set on its
 * registry record: whoever moves the record into STARTING or STOPPING owns
 * the adapter call, everyone else observes or waits for the outcome.
 * Operations on different servers never contend.</p>
 *
 * <h2>Transitions</h2>
 * <pre>
 * STOPPED/ERROR/TIMEOUT → STARTING → RUNNING | ERROR
 * any other (not STOPPED) → STOPPING → STOPPED | ERROR
 * </pre>
 *
 * <p>The startup timeout is not enforced here; a start that never settles
 * is detected by the health scheduler.</p>
 */
public class LifecycleController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleController.class);

    private final ServerRegistry registry;
    private final AdapterRegistry adapterRegistry;
    private final HubConfig config;
    private final Clock clock;

    private final Map<String, ServerAdapter> adapters = new ConcurrentHashMap<>();

    private final ExecutorService lifecycleExecutor;
    private final ExecutorService adapterExecutor;

    /**
     * Create a lifecycle controller.
     *
     * @param registry server registry
     * @param adapterRegistry adapter factories by type
     * @param config hub configuration
     * @param clock clock for record timestamps
     */
    public LifecycleController(
            @Nonnull ServerRegistry registry,
            @Nonnull AdapterRegistry adapterRegistry,
            @Nonnull HubConfig config,
            @Nonnull Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapterRegistry = Objects.requireNonNull(adapterRegistry, "adapterRegistry");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.lifecycleExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "LifecycleController-Async");
            t.setDaemon(true);
            return t;
        });

        this.adapterExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "LifecycleController-Adapter");
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Start ====================

    /**
     * Start a server.
     *
     * <p>The start is claimed on the calling thread, so of several concurrent
     * calls for the same ID exactly one reaches the adapter.</p>
     *
     * @param serverConfig server configuration
     * @return future completing with the resulting record
     */
    @Nonnull
    public CompletableFuture<OperationResult> start(@Nonnull ServerConfig serverConfig) {
        Objects.requireNonNull(serverConfig, "serverConfig");

        String invalid = validate(serverConfig);
        if (invalid != null) {
            LOGGER.warn("Rejected start of '{}': {}", serverConfig.id(), invalid);
            return CompletableFuture.completedFuture(
                    OperationResult.validationFailed(serverConfig.id(), invalid));
        }

        String serverId = serverConfig.id();
        ServerRecord starting;
        ServerStatus previousStatus;
        while (true) {
            Instant now = clock.instant();
            ServerRecord current = registry.getServer(serverId);

            if (current == null) {
                starting = ServerRecord.starting(serverConfig, now, null);
                previousStatus = null;
                if (registry.register(starting) == null) {
                    break;
                }
                continue;
            }

            if (!current.status().isResting()) {
                LOGGER.debug("Server '{}' is {}, start ignored", serverId, current.status());
                return CompletableFuture.completedFuture(OperationResult.completed(current));
            }

            starting = ServerRecord.starting(serverConfig, now, current);
            previousStatus = current.status();
            if (registry.replace(current, starting)) {
                break;
            }
        }

        LOGGER.info("Starting server: {} ({}) on port {}", serverId, serverConfig.type(), serverConfig.port());
        ServerRecord claimed = starting;
        ServerStatus claimedFrom = previousStatus;
        return CompletableFuture.supplyAsync(() -> runStart(claimed, claimedFrom), lifecycleExecutor);
    }

    @Nullable
    private String validate(ServerConfig serverConfig) {
        if (serverConfig.id() == null || serverConfig.id().isBlank()) {
            return "Server id must not be empty";
        }
        if (serverConfig.port() <= 0) {
            return "Port must be positive: " + serverConfig.port();
        }
        if (serverConfig.type() == null || serverConfig.type().isBlank()) {
            return "Server type must not be empty";
        }
        if (!adapterRegistry.hasType(serverConfig.type())) {
            return "Unknown server type: " + serverConfig.type();
        }
        return null;
    }

    private OperationResult runStart(ServerRecord starting, @Nullable ServerStatus previousStatus) {
        String serverId = starting.getId();

        AdapterResult result = releasePreviousAdapter(serverId, previousStatus);
        if (result.success()) {
            try {
                ServerAdapter adapter = adapterRegistry.create(starting.config());
                adapters.put(serverId, adapter);
                result = adapter.doStart();
                if (result == null) {
                    result = AdapterResult.failure("Adapter returned no start result");
                }
            } catch (Exception e) {
                result = AdapterResult.failure(describe(e));
            }
        }

        Instant now = clock.instant();
        ServerRecord next = result.success()
                ? starting.running(now)
                : starting.withError(result.reason(), now);

        if (registry.replace(starting, next)) {
            if (result.success()) {
                LOGGER.info("Server '{}' started successfully on port {}", serverId, starting.config().port());
            } else {
                LOGGER.error("Failed to start server '{}': {}", serverId, result.reason());
            }
            return OperationResult.completed(next);
        }

        ServerRecord current = registry.getServer(serverId);
        LOGGER.warn("Server '{}' left STARTING before its start settled (now {}), discarding {} start result",
                serverId, current != null ? current.status() : "unregistered",
                result.success() ? "successful" : "failed");
        return current != null ? OperationResult.completed(current) : OperationResult.unknownServer(serverId);
    }

    /**
     * Terminate the adapter left behind by a start that timed out or a
     * server that failed, before a new adapter takes over the ID.
     *
     * <p>If the old instance cannot be terminated it stays owned by the ID
     * and the new start fails.</p>
     */
    private AdapterResult releasePreviousAdapter(String serverId, @Nullable ServerStatus previousStatus) {
        ServerAdapter previous = adapters.get(serverId);
        if (previous == null || previousStatus == null || previousStatus == ServerStatus.STOPPED) {
            return AdapterResult.ok();
        }

        LOGGER.info("Terminating previous instance of '{}' left in {}", serverId, previousStatus);
        AdapterResult forced = callAdapter(
                previous::forceStop, config.getForcedShutdownTimeout(), "Forced termination");
        if (!forced.success()) {
            return AdapterResult.failure("Previous instance could not be terminated: " + forced.reason());
        }

        adapters.remove(serverId, previous);
        return forced;
    }

    // ==================== Stop ====================

    /**
     * Stop a server, gracefully first and forcibly after the grace period.
     *
     * <p>Stopping a STOPPED server is a no-op. A stop issued while the server
     * is STARTING waits for the start to settle; a stop issued while another
     * stop is in progress waits for that stop and returns its outcome.</p>
     *
     * @param serverId server identifier
     * @return future completing with the resulting record
     */
    @Nonnull
    public CompletableFuture<OperationResult> stop(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");

        if (!registry.hasServer(serverId)) {
            LOGGER.warn("Server not found for stop: {}", serverId);
            return CompletableFuture.completedFuture(OperationResult.unknownServer(serverId));
        }

        return CompletableFuture.supplyAsync(() -> runStop(serverId), lifecycleExecutor);
    }

    private OperationResult runStop(String serverId) {
        while (true) {
            ServerRecord current = registry.getServer(serverId);
            if (current == null) {
                return OperationResult.unknownServer(serverId);
            }

            switch (current.status()) {
                case STOPPED:
                    return OperationResult.completed(current);

                case STARTING:
                    LOGGER.debug("Server '{}' is starting, waiting before stop", serverId);
                    registry.awaitStatus(serverId, status -> status != ServerStatus.STARTING).join();
                    break;

                case STOPPING:
                    LOGGER.debug("Server '{}' is already stopping, waiting for it", serverId);
                    ServerRecord settled = registry
                            .awaitStatus(serverId, status -> status != ServerStatus.STOPPING)
                            .join();
                    return settled != null
                            ? OperationResult.completed(settled)
                            : OperationResult.unknownServer(serverId);

                default:
                    ServerRecord stopping = current.withStatus(ServerStatus.STOPPING, clock.instant());
                    if (registry.replace(current, stopping)) {
                        return OperationResult.completed(terminate(stopping));
                    }
                    break;
            }
        }
    }

    private ServerRecord terminate(ServerRecord stopping) {
        String serverId = stopping.getId();
        LOGGER.info("Stopping server: {}", serverId);

        ServerAdapter adapter = adapters.get(serverId);
        String failure = null;

        if (adapter != null) {
            Duration grace = config.getGracefulShutdownTimeout();
            AdapterResult graceful = callAdapter(adapter::doStop, grace, "Graceful shutdown");

            if (graceful.success()) {
                LOGGER.info("Server '{}' shut down gracefully", serverId);
            } else {
                LOGGER.warn("Server '{}' did not shut down gracefully ({}), forcing...",
                        serverId, graceful.reason());

                AdapterResult forced = callAdapter(
                        adapter::forceStop, config.getForcedShutdownTimeout(), "Forced termination");
                if (forced.success()) {
                    LOGGER.warn("Server '{}' forcibly terminated", serverId);
                } else {
                    failure = "Shutdown failed: " + forced.reason();
                }
            }
        }

        Instant now = clock.instant();
        ServerRecord next = failure == null
                ? stopping.stopped(now)
                : stopping.withError(failure, now);

        if (!registry.replace(stopping, next)) {
            ServerRecord current = registry.getServer(serverId);
            LOGGER.warn("Server '{}' changed while stopping, keeping {}",
                    serverId, current != null ? current.status() : "unregistered");
            return current != null ? current : next;
        }

        if (failure != null) {
            LOGGER.error("Failed to stop server '{}': {}", serverId, failure);
        } else {
            LOGGER.info("Server '{}' stopped", serverId);
        }
        return next;
    }

    private AdapterResult callAdapter(Callable<AdapterResult> call, Duration timeout, String action) {
        Future<AdapterResult> future = adapterExecutor.submit(call);
        try {
            AdapterResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : AdapterResult.failure(action + " returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return AdapterResult.failure(action + " timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            return AdapterResult.failure(describe(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AdapterResult.failure(action + " interrupted");
        }
    }

    // ==================== Restart ====================

    /**
     * Stop a server and start it again with its stored configuration.
     *
     * <p>If the stop ends in ERROR the restart is aborted and the failed
     * record is returned.</p>
     *
     * @param serverId server identifier
     * @return future completing with the resulting record
     */
    @Nonnull
    public CompletableFuture<OperationResult> restart(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");

        if (!registry.hasServer(serverId)) {
            LOGGER.warn("Server not found for restart: {}", serverId);
            return CompletableFuture.completedFuture(OperationResult.unknownServer(serverId));
        }

        LOGGER.info("Restarting server: {}", serverId);
        return stop(serverId).thenCompose(result -> {
            if (!result.isCompleted()) {
                return CompletableFuture.completedFuture(result);
            }

            ServerRecord stopped = result.requireRecord();
            if (stopped.status() == ServerStatus.ERROR) {
                LOGGER.warn("Restart of '{}' aborted: {}", serverId, stopped.errorMessage());
                return CompletableFuture.completedFuture(result);
            }

            return start(stopped.config());
        });
    }

    // ==================== Queries ====================

    /**
     * Get the adapter owned by a server.
     *
     * @param serverId server identifier
     * @return the adapter, or null if the server was never started
     */
    @Nullable
    public ServerAdapter getAdapter(@Nonnull String serverId) {
        return adapters.get(serverId);
    }

    // ==================== Shutdown ====================

    /**
     * Stop every registered server and wait for the stops to finish.
     *
     * @param timeout maximum time to wait
     */
    public void stopAll(@Nonnull Duration timeout) {
        List<CompletableFuture<OperationResult>> futures = new ArrayList<>();
        for (ServerRecord record : registry.getAllServers()) {
            futures.add(stop(record.getId()));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Timeout waiting for server shutdowns, forcing...");
            for (Map.Entry<String, ServerAdapter> entry : adapters.entrySet()) {
                ServerRecord record = registry.getServer(entry.getKey());
                if (record != null && record.status() != ServerStatus.STOPPED) {
                    callAdapter(entry.getValue()::forceStop, config.getForcedShutdownTimeout(), "Forced termination");
                }
            }
        } catch (ExecutionException e) {
            LOGGER.error("Error stopping servers: {}", describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Shutdown the controller's executors.
     */
    public void shutdown() {
        lifecycleExecutor.shutdown();
        adapterExecutor.shutdown();

        try {
            if (!lifecycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                lifecycleExecutor.shutdownNow();
            }
            if (!adapterExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                adapterExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            lifecycleExecutor.shutdownNow();
            adapterExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        adapters.clear();
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
