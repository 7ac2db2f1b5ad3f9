package no.boreas.support;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

public class MutableClock extends Clock {
    private final ZoneId zone;
    private final AtomicReference<Instant> instant;

    public MutableClock(Instant initial, ZoneId zone) {
        this.zone = zone;
        this.instant = new AtomicReference<>(initial);
    }

    /**
     * Clock reading {@code local} in {@code zone}.
     */
    public static MutableClock at(String local, ZoneId zone) {
        return new MutableClock(LocalDateTime.parse(local).atZone(zone).toInstant(), zone);
    }

    public void setInstant(Instant next) {
        instant.set(next);
    }

    public void setLocal(String local) {
        instant.set(LocalDateTime.parse(local).atZone(zone).toInstant());
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant(), zone);
    }

    @Override
    public Instant instant() {
        return instant.get();
    }
}
