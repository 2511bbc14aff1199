package com.questrail.agentsession.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for delays: grace periods, flush intervals, shutdown deadlines.
 *
 * <p>
 * Session timestamps (message times, last activity, event times) come from
 * {@link WallClock}. Anything that waits uses this clock instead, so wall-clock
 * adjustments can neither shorten nor stretch a delay.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
