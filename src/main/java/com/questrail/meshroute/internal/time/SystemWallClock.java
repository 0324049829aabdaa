package com.questrail.meshroute.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>May jump with NTP or manual adjustments. Never use it to arm a
 * deadline; use {@link MonotonicClock} for that.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
