package me.golemcore.quota.testsupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

public final class MutableClock extends Clock {

    private final AtomicReference<Instant> currentInstant;
    private final ZoneId zone;

    public MutableClock(Instant instant, ZoneId zone) {
        this(new AtomicReference<>(instant), zone);
    }

    private MutableClock(AtomicReference<Instant> currentInstant, ZoneId zone) {
        this.currentInstant = currentInstant;
        this.zone = zone;
    }

    public void setInstant(Instant instant) {
        currentInstant.set(instant);
    }

    public void advance(Duration duration) {
        currentInstant.updateAndGet(instant -> instant.plus(duration));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(currentInstant, zone);
    }

    @Override
    public Instant instant() {
        return currentInstant.get();
    }
}
