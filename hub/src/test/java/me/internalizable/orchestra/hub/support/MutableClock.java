package me.internalizable.orchestra.hub.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

public final class MutableClock extends Clock {
    private volatile Instant instant = Instant.parse("2025-01-01T00:00:00Z");
    private final ZoneId zone;

    public MutableClock() {
        this(ZoneId.of("UTC"));
    }

    private MutableClock(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        MutableClock copy = new MutableClock(zone);
        copy.instant = this.instant;
        return copy;
    }

    @Override
    public Instant instant() {
        return instant;
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }
}
