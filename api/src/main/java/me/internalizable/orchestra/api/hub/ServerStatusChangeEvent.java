package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Event fired when a server's status changes.
 */
public class ServerStatusChangeEvent {

    private final ServerRecord previous;
    private final ServerRecord current;

    /**
     * Create a status change event.
     *
     * @param previous record before the change, or null for a newly created server
     * @param current record after the change
     */
    public ServerStatusChangeEvent(@Nullable ServerRecord previous, @Nonnull ServerRecord current) {
        this.previous = previous;
        this.current = Objects.requireNonNull(current, "current");
    }

    @Nonnull
    public String getServerId() {
        return current.getId();
    }

    /**
     * Get the record before the change.
     *
     * @return previous record, or null if the server was just created
     */
    @Nullable
    public ServerRecord getPrevious() {
        return previous;
    }

    @Nonnull
    public ServerRecord getCurrent() {
        return current;
    }

    /**
     * Get the previous status.
     *
     * @return previous status, or null if the server was just created
     */
    @Nullable
    public ServerStatus getPreviousStatus() {
        return previous != null ? previous.status() : null;
    }

    @Nonnull
    public ServerStatus getNewStatus() {
        return current.status();
    }

    /**
     * Check if the transition ended in a failure state.
     *
     * @return true if now ERROR, TIMEOUT or NOT_RESPONDING
     */
    public boolean becameUnhealthy() {
        ServerStatus status = current.status();
        return status == ServerStatus.ERROR
                || status == ServerStatus.TIMEOUT
                || status == ServerStatus.NOT_RESPONDING;
    }

    /**
     * Check if a recovery strategy brought the server back.
     *
     * @return true if it went from ERROR straight to RUNNING
     */
    public boolean recovered() {
        return getPreviousStatus() == ServerStatus.ERROR && current.status() == ServerStatus.RUNNING;
    }

    @Override
    public String toString() {
        return "ServerStatusChangeEvent{" +
                "serverId='" + getServerId() + '\'' +
                ", " + getPreviousStatus() + " -> " + getNewStatus() +
                '}';
    }
}
