package me.internalizable.orchestra.api.hub.adapter;

import me.internalizable.orchestra.api.hub.HealthMetrics;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Result of a health probe.
 *
 * @param state probe outcome
 * @param metrics metrics reported by a live server, null otherwise
 * @param message detail for dead or timed out probes
 */
public record ProbeResult(@Nonnull State state, @Nullable HealthMetrics metrics, @Nullable String message) {

    /**
     * Probe outcomes.
     */
    public enum State {
        ALIVE,
        DEAD,
        TIMEOUT
    }

    public ProbeResult {
        Objects.requireNonNull(state, "state");
    }

    @Nonnull
    public static ProbeResult alive(@Nonnull HealthMetrics metrics) {
        return new ProbeResult(State.ALIVE, Objects.requireNonNull(metrics, "metrics"), null);
    }

    @Nonnull
    public static ProbeResult alive() {
        return alive(HealthMetrics.EMPTY);
    }

    @Nonnull
    public static ProbeResult dead(@Nullable String message) {
        return new ProbeResult(State.DEAD, null, message);
    }

    @Nonnull
    public static ProbeResult timeout() {
        return new ProbeResult(State.TIMEOUT, null, "Probe timed out");
    }

    public boolean isAlive() {
        return state == State.ALIVE;
    }
}
