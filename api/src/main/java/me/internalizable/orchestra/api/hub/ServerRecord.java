package me.internalizable.orchestra.api.hub;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one managed server's state.
 *
 * <p>Records are never modified. Every change produces a new record that
 * replaces the previous one in the hub's registry as a whole.</p>
 *
 * <h2>Lifecycle States</h2>
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓          ↓
 *        ERROR/TIMEOUT  NOT_RESPONDING  ERROR
 * </pre>
 *
 * @param config server configuration
 * @param status current status
 * @param startTime when the server last entered RUNNING, or null if it never did
 * @param lastHealthCheck time of the last successful probe, or null
 * @param statusChangedAt time of the last status transition
 * @param errorMessage failure description, or null
 * @param healthMetrics metrics from the last successful probe, or null
 */
public record ServerRecord(
        @Nonnull ServerConfig config,
        @Nonnull ServerStatus status,
        @Nullable Instant startTime,
        @Nullable Instant lastHealthCheck,
        @Nonnull Instant statusChangedAt,
        @Nullable String errorMessage,
        @Nullable HealthMetrics healthMetrics
) {

    public ServerRecord {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(statusChangedAt, "statusChangedAt");
    }

    /**
     * Create the record for a server whose start has just been claimed.
     *
     * @param config configuration to start with
     * @param now current time
     * @param previous the record being replaced, or null for a new server
     * @return a STARTING record
     */
    @Nonnull
    public static ServerRecord starting(
            @Nonnull ServerConfig config,
            @Nonnull Instant now,
            @Nullable ServerRecord previous) {
        Instant previousStart = previous != null ? previous.startTime : null;
        return new ServerRecord(config, ServerStatus.STARTING, previousStart, null, now, null, null);
    }

    /**
     * Get the server identifier.
     *
     * @return server ID
     */
    @Nonnull
    public String getId() {
        return config.id();
    }

    /**
     * Get the failure description.
     *
     * @return error message, if any
     */
    @Nonnull
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Copy with a different status.
     *
     * @param newStatus new status
     * @param now current time
     * @return updated record
     */
    @Nonnull
    public ServerRecord withStatus(@Nonnull ServerStatus newStatus, @Nonnull Instant now) {
        Instant changedAt = newStatus != status ? now : statusChangedAt;
        return new ServerRecord(config, newStatus, startTime, lastHealthCheck, changedAt, errorMessage, healthMetrics);
    }

    /**
     * Copy that entered RUNNING at {@code now}.
     *
     * <p>The start time never goes backwards: if the clock has not advanced
     * past the previous start, the new start is placed one nanosecond after it.</p>
     *
     * @param now current time
     * @return running record with a fresh start time and no error
     */
    @Nonnull
    public ServerRecord running(@Nonnull Instant now) {
        Instant nextStart = startTime == null || now.isAfter(startTime)
                ? now
                : startTime.plusNanos(1);
        return new ServerRecord(config, ServerStatus.RUNNING, nextStart, lastHealthCheck, now, null, healthMetrics);
    }

    /**
     * Copy in ERROR with the given message.
     *
     * @param message failure description
     * @param now current time
     * @return failed record
     */
    @Nonnull
    public ServerRecord withError(@Nonnull String message, @Nonnull Instant now) {
        return failed(ServerStatus.ERROR, message, now);
    }

    /**
     * Copy in a failure status with the given message.
     *
     * @param failureStatus ERROR, TIMEOUT or NOT_RESPONDING
     * @param message failure description
     * @param now current time
     * @return failed record
     */
    @Nonnull
    public ServerRecord failed(@Nonnull ServerStatus failureStatus, @Nonnull String message, @Nonnull Instant now) {
        Instant changedAt = failureStatus != status ? now : statusChangedAt;
        return new ServerRecord(config, failureStatus, startTime, lastHealthCheck, changedAt, message, healthMetrics);
    }

    /**
     * Copy after a successful health probe.
     *
     * @param metrics metrics reported by the probe
     * @param now current time
     * @return record with refreshed metrics and health check time
     */
    @Nonnull
    public ServerRecord withHealthCheck(@Nonnull HealthMetrics metrics, @Nonnull Instant now) {
        return new ServerRecord(config, status, startTime, now, statusChangedAt, errorMessage, metrics);
    }

    /**
     * Copy that has been stopped.
     *
     * <p>Keeps the last start time so a later start can be ordered after it.</p>
     *
     * @param now current time
     * @return STOPPED record without error or metrics
     */
    @Nonnull
    public ServerRecord stopped(@Nonnull Instant now) {
        return new ServerRecord(config, ServerStatus.STOPPED, startTime, lastHealthCheck, now, null, null);
    }

    /**
     * Get the time spent in the current RUNNING period.
     *
     * @param now current time
     * @return uptime, or zero if not running
     */
    @Nonnull
    public Duration getUptime(@Nonnull Instant now) {
        if (status != ServerStatus.RUNNING || startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, now);
    }
}
