package com.questrail.agentsession.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the timestamps handed to the transition function.
 *
 * <p>
 * The transition function never reads a clock itself; the session actor reads
 * this one once per input and passes the value in. Tests substitute a fixed
 * or stepping clock to make whole sessions reproducible.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
