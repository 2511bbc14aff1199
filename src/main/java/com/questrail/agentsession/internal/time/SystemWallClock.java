package com.questrail.agentsession.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>May jump forward or backward due to NTP or manual adjustments. Delays
 * must use {@link MonotonicClock}.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
