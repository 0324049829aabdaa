package com.questrail.meshroute.time;

import com.questrail.meshroute.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall clock that only moves when told to.
 */
public final class ManualWallClock implements WallClock {

    private final AtomicReference<Instant> now;

    public ManualWallClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public ManualWallClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration delta) {
        now.updateAndGet(t -> t.plus(delta));
    }
}
