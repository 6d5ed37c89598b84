package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a lifecycle operation.
 *
 * <p>Adapter failures are not reported here: an operation that reached the
 * adapter always {@link Outcome#COMPLETED completes} and the returned record
 * carries the resulting ERROR or TIMEOUT status.</p>
 */
public final class OperationResult {

    /**
     * Kinds of operation outcomes.
     */
    public enum Outcome {
        /**
         * Operation ran; inspect the record for the resulting status.
         */
        COMPLETED,

        /**
         * The supplied configuration was rejected before any state change.
         */
        VALIDATION_FAILED,

        /**
         * No server with the given ID is known.
         */
        UNKNOWN_SERVER
    }

    private final Outcome outcome;
    private final String serverId;
    private final ServerRecord record;
    private final String message;

    private OperationResult(
            @Nonnull Outcome outcome,
            @Nullable String serverId,
            @Nullable ServerRecord record,
            @Nullable String message) {
        this.outcome = outcome;
        this.serverId = serverId;
        this.record = record;
        this.message = message;
    }

    @Nonnull
    public static OperationResult completed(@Nonnull ServerRecord record) {
        Objects.requireNonNull(record, "record");
        return new OperationResult(Outcome.COMPLETED, record.getId(), record, null);
    }

    @Nonnull
    public static OperationResult validationFailed(@Nullable String serverId, @Nonnull String message) {
        Objects.requireNonNull(message, "message");
        return new OperationResult(Outcome.VALIDATION_FAILED, serverId, null, message);
    }

    @Nonnull
    public static OperationResult unknownServer(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return new OperationResult(Outcome.UNKNOWN_SERVER, serverId, null, "Server not found: " + serverId);
    }

    @Nonnull
    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Check if the operation ran.
     *
     * @return true if completed
     */
    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }

    /**
     * Get the server ID the operation targeted.
     *
     * @return server ID, or null if the configuration carried none
     */
    @Nullable
    public String getServerId() {
        return serverId;
    }

    /**
     * Get the resulting record.
     *
     * @return record, present only for completed operations
     */
    @Nonnull
    public Optional<ServerRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    /**
     * Get the resulting record of a completed operation.
     *
     * @return the record
     * @throws IllegalStateException if the operation did not complete
     */
    @Nonnull
    public ServerRecord requireRecord() {
        if (record == null) {
            throw new IllegalStateException("No record for " + outcome + ": " + message);
        }
        return record;
    }

    /**
     * Get the rejection message.
     *
     * @return message, or null for completed operations
     */
    @Nullable
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "OperationResult{" +
                "outcome=" + outcome +
                ", serverId='" + serverId + '\'' +
                (record != null ? ", status=" + record.status() : "") +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
