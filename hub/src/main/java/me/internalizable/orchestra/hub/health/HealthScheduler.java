package me.internalizable.orchestra.hub.health;

import me.internalizable.orchestra.api.hub.HealthMetrics;
import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.adapter.AdapterResult;
import me.internalizable.orchestra.api.hub.adapter.ProbeResult;
import me.internalizable.orchestra.api.hub.adapter.RecoveryStrategy;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import me.internalizable.orchestra.hub.config.HubConfig;
import me.internalizable.orchestra.hub.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Periodically checks every registered server.
 *
 * <p>Each tick fans out one independent task per server. A slow or failing
 * probe only affects the server it belongs to, and nothing a probe does can
 * end the scheduling loop.</p>
 *
 * <p>Results are written back with compare-and-set against the record the
 * task started from. If a lifecycle operation changed the record meanwhile,
 * the health result is dropped.</p>
 */
public class HealthScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthScheduler.class);

    private final ServerRegistry registry;
    private final Function<String, ServerAdapter> adapterLookup;
    private final HubConfig config;
    private final Clock clock;

    @Nullable
    private final RecoveryStrategy recoveryStrategy;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;

    // At most one recovery per server, even when it outlasts a tick
    private final Set<String> recovering = ConcurrentHashMap.newKeySet();

    private volatile boolean started = false;
    private volatile boolean shutdown = false;

    /**
     * Create a health scheduler.
     *
     * @param registry server registry
     * @param adapterLookup resolves the adapter owned by a server ID
     * @param config hub configuration
     * @param clock clock used for timestamps and the startup timeout
     * @param recoveryStrategy strategy for servers in ERROR, or null to leave them failed
     */
    public HealthScheduler(
            @Nonnull ServerRegistry registry,
            @Nonnull Function<String, ServerAdapter> adapterLookup,
            @Nonnull HubConfig config,
            @Nonnull Clock clock,
            @Nullable RecoveryStrategy recoveryStrategy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapterLookup = Objects.requireNonNull(adapterLookup, "adapterLookup");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.recoveryStrategy = recoveryStrategy;

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "HealthScheduler");
            t.setDaemon(true);
            return t;
        });

        // Unbounded: more servers means more concurrent probes, never fewer checks per tick
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "HealthScheduler-Probe");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the periodic health checks.
     */
    public void start() {
        if (started) {
            throw new IllegalStateException("Health scheduler already started");
        }
        started = true;

        long interval = config.getHealthCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduledTick, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Health scheduler started (interval {}s)", config.getHealthCheckIntervalSeconds());
    }

    private void runScheduledTick() {
        try {
            tick();
        } catch (Exception e) {
            LOGGER.error("Health check tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one health check pass over all registered servers.
     *
     * <p>Does not block; the returned future completes once every server's
     * check of this tick has finished.</p>
     *
     * @return completion future for this tick
     */
    @Nonnull
    public CompletableFuture<Void> tick() {
        if (shutdown) {
            return CompletableFuture.completedFuture(null);
        }

        List<ServerRecord> snapshot = registry.getAllServers();
        if (snapshot.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        LOGGER.debug("Performing health checks for {} servers", snapshot.size());

        CompletableFuture<?>[] checks = snapshot.stream()
                .map(record -> CompletableFuture.runAsync(() -> checkServer(record), probeExecutor))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks);
    }

    // ==================== Per-server Checks ====================

    private void checkServer(ServerRecord record) {
        String serverId = record.getId();
        try {
            ServerRecord next = switch (record.status()) {
                case RUNNING -> probeRunning(record);
                case STARTING -> checkStartupProgress(record);
                case ERROR -> attemptRecovery(record);
                default -> record;
            };

            if (next != record && !registry.replace(record, next)) {
                LOGGER.debug("Server '{}' changed during health check, result discarded", serverId);
            }
        } catch (Exception e) {
            LOGGER.warn("Health check failed for '{}': {}", serverId, describe(e));
            ServerRecord failed = record.withError("Health check failed: " + describe(e), clock.instant());
            if (!registry.replace(record, failed)) {
                LOGGER.debug("Server '{}' changed during failed health check, error not recorded", serverId);
            }
        }
    }

    private ServerRecord probeRunning(ServerRecord record) throws Exception {
        String serverId = record.getId();
        ServerAdapter adapter = adapterLookup.apply(serverId);
        if (adapter == null) {
            throw new IllegalStateException("No adapter for running server " + serverId);
        }

        ProbeResult result = probe(adapter, config.getProbeTimeout());
        Instant now = clock.instant();

        if (result.isAlive()) {
            HealthMetrics metrics = result.metrics() != null ? result.metrics() : HealthMetrics.EMPTY;
            return record.withHealthCheck(metrics, now);
        }

        String message = result.message() != null
                ? result.message()
                : "Probe reported " + result.state();
        LOGGER.warn("Server '{}' not responding: {}", serverId, message);
        return record.failed(ServerStatus.NOT_RESPONDING, message, now);
    }

    private ProbeResult probe(ServerAdapter adapter, Duration timeout) throws Exception {
        Future<ProbeResult> future = probeExecutor.submit(() -> adapter.probe(timeout));
        try {
            ProbeResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ProbeResult.dead("Probe returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProbeResult.timeout();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.dead("Probe interrupted");
        }
    }

    private ServerRecord checkStartupProgress(ServerRecord record) {
        Duration timeout = config.getStartupTimeout();
        Instant now = clock.instant();
        Duration elapsed = Duration.between(record.statusChangedAt(), now);

        if (elapsed.compareTo(timeout) <= 0) {
            return record;
        }

        LOGGER.warn("Server '{}' did not finish starting within {}s", record.getId(), timeout.toSeconds());
        return record.failed(ServerStatus.TIMEOUT,
                "Startup did not complete within " + timeout.toSeconds() + "s", now);
    }

    private ServerRecord attemptRecovery(ServerRecord record) {
        if (recoveryStrategy == null) {
            return record;
        }

        String serverId = record.getId();
        ServerAdapter adapter = adapterLookup.apply(serverId);
        if (adapter == null) {
            return record;
        }

        if (!recovering.add(serverId)) {
            LOGGER.debug("Recovery of '{}' already in progress", serverId);
            return record;
        }

        LOGGER.info("Attempting recovery for server: {}", serverId);
        AdapterResult result;
        try {
            result = recoveryStrategy.recover(record, adapter);
        } catch (Exception e) {
            result = AdapterResult.failure(describe(e));
        } finally {
            recovering.remove(serverId);
        }

        if (result == null || !result.success()) {
            LOGGER.debug("Recovery of '{}' failed: {}", serverId, result != null ? result.reason() : "no result");
            return record;
        }

        LOGGER.info("Server '{}' recovered", serverId);
        return record.running(clock.instant());
    }

    // ==================== Shutdown ====================

    /**
     * Stop the periodic health checks.
     */
    public void shutdown() {
        shutdown = true;

        scheduler.shutdown();
        probeExecutor.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Health scheduler shut down");
    }

    public boolean isStarted() {
        return started;
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
