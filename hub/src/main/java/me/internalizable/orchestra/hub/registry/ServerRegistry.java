package me.internalizable.orchestra.hub.registry;

import me.internalizable.orchestra.api.hub.ServerRecord;
import me.internalizable.orchestra.api.hub.ServerStatus;
import me.internalizable.orchestra.api.hub.ServerStatusChangeEvent;
import me.internalizable.orchestra.api.hub.ServerStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory registry of all managed servers.
 *
 * <p>The only shared mutable state of the hub. Values are immutable
 * {@link ServerRecord}s; every change replaces a whole record through
 * {@link #register(ServerRecord)} or the compare-and-set
 * {@link #replace(ServerRecord, ServerRecord)}, so readers never observe
 * a partially updated server.</p>
 */
public class ServerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<String, ServerRecord> servers = new ConcurrentHashMap<>();
    private final Queue<String> registrationOrder = new ConcurrentLinkedQueue<>();
    private final Map<String, Queue<StatusWaiter>> waiters = new ConcurrentHashMap<>();
    private final List<ServerStatusListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Register a new server record.
     *
     * @param record the record to add
     * @return null if the record was added, otherwise the record already registered under its ID
     */
    @Nullable
    public ServerRecord register(@Nonnull ServerRecord record) {
        Objects.requireNonNull(record, "record");

        ServerRecord existing = servers.putIfAbsent(record.getId(), record);
        if (existing != null) {
            return existing;
        }

        registrationOrder.add(record.getId());
        LOGGER.debug("Registered server: {} ({})", record.getId(), record.status());
        publish(null, record);
        return null;
    }

    /**
     * Atomically replace a record if it is still the current one.
     *
     * @param expected the record the caller based its change on
     * @param next the replacement
     * @return true if replaced, false if the record changed meanwhile
     */
    public boolean replace(@Nonnull ServerRecord expected, @Nonnull ServerRecord next) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(next, "next");
        if (!expected.getId().equals(next.getId())) {
            throw new IllegalArgumentException("Cannot replace " + expected.getId() + " with " + next.getId());
        }

        if (!servers.replace(expected.getId(), expected, next)) {
            return false;
        }

        if (expected.status() != next.status()) {
            LOGGER.debug("Server {}: {} -> {}", next.getId(), expected.status(), next.status());
        }
        publish(expected, next);
        return true;
    }

    /**
     * Get a server by ID.
     *
     * @param serverId server identifier
     * @return the current record, or null if not found
     */
    @Nullable
    public ServerRecord getServer(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return servers.get(serverId);
    }

    /**
     * Check if a server is registered.
     *
     * @param serverId server identifier
     * @return true if registered
     */
    public boolean hasServer(@Nonnull String serverId) {
        return servers.containsKey(serverId);
    }

    /**
     * Get all registered servers.
     *
     * @return snapshot of the records in registration order
     */
    @Nonnull
    public List<ServerRecord> getAllServers() {
        List<ServerRecord> snapshot = new ArrayList<>(servers.size());
        for (String serverId : registrationOrder) {
            ServerRecord record = servers.get(serverId);
            if (record != null) {
                snapshot.add(record);
            }
        }
        return List.copyOf(snapshot);
    }

    /**
     * Get the number of registered servers.
     *
     * @return server count
     */
    public int getServerCount() {
        return servers.size();
    }

    /**
     * Wait until a server reaches a status matching the condition.
     *
     * <p>Completes immediately if the current record already matches. Completes
     * with null if the server is not registered or the registry is cleared.</p>
     *
     * @param serverId server identifier
     * @param condition status condition
     * @return future completing with the first matching record
     */
    @Nonnull
    public CompletableFuture<ServerRecord> awaitStatus(
            @Nonnull String serverId,
            @Nonnull Predicate<ServerStatus> condition) {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(condition, "condition");

        StatusWaiter waiter = new StatusWaiter(condition, new CompletableFuture<>());
        Queue<StatusWaiter> queue = waiters.computeIfAbsent(serverId, id -> new ConcurrentLinkedQueue<>());
        queue.add(waiter);

        // Registered before reading, so a concurrent replace either is seen here or signals the waiter
        ServerRecord current = servers.get(serverId);
        if (current == null) {
            waiter.future().complete(null);
        } else {
            waiter.tryComplete(current);
        }
        if (waiter.future().isDone()) {
            queue.remove(waiter);
        }
        return waiter.future();
    }

    /**
     * Add a status listener.
     *
     * @param listener the listener
     */
    public void addListener(@Nonnull ServerStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Remove a status listener.
     *
     * @param listener the listener
     */
    public void removeListener(@Nonnull ServerStatusListener listener) {
        listeners.remove(listener);
    }

    /**
     * Clear all registrations.
     */
    public void clear() {
        servers.clear();
        registrationOrder.clear();
        for (Queue<StatusWaiter> queue : waiters.values()) {
            queue.forEach(waiter -> waiter.future().complete(null));
        }
        waiters.clear();
        LOGGER.debug("Registry cleared");
    }

    private void publish(@Nullable ServerRecord previous, ServerRecord current) {
        Queue<StatusWaiter> queue = waiters.get(current.getId());
        if (queue != null) {
            queue.removeIf(waiter -> waiter.tryComplete(current));
        }

        if (previous != null && previous.status() == current.status()) {
            return;
        }

        ServerStatusChangeEvent event = new ServerStatusChangeEvent(previous, current);
        for (ServerStatusListener listener : listeners) {
            try {
                listener.onStatusChange(event);
            } catch (Exception e) {
                LOGGER.warn("Status listener failed for '{}': {}", current.getId(), e.getMessage(), e);
            }
        }
    }

    private record StatusWaiter(Predicate<ServerStatus> condition, CompletableFuture<ServerRecord> future) {

        /**
         * @return true if the waiter is done and can be dropped
         */
        boolean tryComplete(ServerRecord record) {
            if (!future.isDone() && condition.test(record.status())) {
                future.complete(record);
            }
            return future.isDone();
        }
    }
}
