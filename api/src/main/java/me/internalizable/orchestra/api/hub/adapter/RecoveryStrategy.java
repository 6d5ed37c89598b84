package me.internalizable.orchestra.api.hub.adapter;

import me.internalizable.orchestra.api.hub.ServerRecord;

import javax.annotation.Nonnull;

/**
 * Attempts to bring a server in ERROR back to RUNNING.
 *
 * <p>Optional. Without a strategy the hub leaves failed servers in ERROR
 * until a caller restarts them.</p>
 */
@FunctionalInterface
public interface RecoveryStrategy {

    /**
     * Try to recover a failed server.
     *
     * @param record the failed server's record
     * @param adapter the server's adapter
     * @return success if the server is running again
     */
    @Nonnull
    AdapterResult recover(@Nonnull ServerRecord record, @Nonnull ServerAdapter adapter);
}
