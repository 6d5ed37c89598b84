package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * API for starting, stopping and observing managed servers.
 *
 * <p>This is an in-process contract. HTTP, gRPC or CLI layers wrap it
 * without the hub knowing about them.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * OrchestrationHubAPI hub = ...;
 *
 * ServerConfig config = ServerConfig.builder("search")
 *     .type("process")
 *     .port(9000)
 *     .metadata("command", "./run-search.sh")
 *     .build();
 *
 * hub.startServer(config).thenAccept(result -> {
 *     ServerRecord record = result.requireRecord();
 *     System.out.println(record.getId() + " is " + record.status());
 * });
 *
 * hub.stopServer("search");
 * }</pre>
 */
public interface OrchestrationHubAPI {

    /**
     * Start a server.
     *
     * <p>Invalid configurations complete immediately with
     * {@link OperationResult.Outcome#VALIDATION_FAILED}. If the server is
     * already known and not resting, the current record is returned unchanged.</p>
     *
     * @param config server configuration
     * @return future completing with the resulting record
     */
    @Nonnull
    CompletableFuture<OperationResult> startServer(@Nonnull ServerConfig config);

    /**
     * Stop a server, gracefully first and forcibly after the grace period.
     *
     * @param serverId server identifier
     * @return future completing with the resulting record, or an unknown-server result
     */
    @Nonnull
    CompletableFuture<OperationResult> stopServer(@Nonnull String serverId);

    /**
     * Stop a server and start it again with its stored configuration.
     *
     * @param serverId server identifier
     * @return future completing with the resulting record, or an unknown-server result
     */
    @Nonnull
    CompletableFuture<OperationResult> restartServer(@Nonnull String serverId);

    /**
     * Get a snapshot of a server.
     *
     * @param serverId server identifier
     * @return the record, or empty if not found
     */
    @Nonnull
    Optional<ServerRecord> getServer(@Nonnull String serverId);

    /**
     * Get snapshots of all servers.
     *
     * @return records in registration order
     */
    @Nonnull
    List<ServerRecord> getAllServers();

    /**
     * Get aggregate counts and hub metrics.
     *
     * @return the overview
     */
    @Nonnull
    SystemOverview getSystemOverview();

    /**
     * Register a status listener.
     *
     * @param listener listener to add
     */
    void addStatusListener(@Nonnull ServerStatusListener listener);

    /**
     * Remove a status listener.
     *
     * @param listener listener to remove
     */
    void removeStatusListener(@Nonnull ServerStatusListener listener);
}
