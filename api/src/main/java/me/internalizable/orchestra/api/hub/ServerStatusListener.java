package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;

/**
 * Receives server status changes.
 *
 * <p>Called synchronously on the thread that performed the transition.
 * Implementations must return quickly and must not call back into
 * lifecycle operations on the same thread.</p>
 */
@FunctionalInterface
public interface ServerStatusListener {

    void onStatusChange(@Nonnull ServerStatusChangeEvent event);
}
