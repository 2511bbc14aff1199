package com.questrail.agentsession.internal.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * WheelTimerScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <h2>Design</h2>
 * <p>Grace-period timers are long (minutes), numerous (one per ended session)
 * and rarely need sub-tick precision, which is the workload a timer wheel is
 * built for. Monotonic deadlines are converted into relative delays at
 * scheduling time using the supplied {@link MonotonicClock}.</p>
 *
 * <h2>Ownership</h2>
 * <p>When constructed with {@link #create(MonotonicClock)} this scheduler owns
 * its timer and {@link #stop()} releases the timer thread. When wrapping an
 * externally supplied {@link Timer}, the caller stays responsible for it.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may run up to one tick after their deadline, but never before.</p>
 */
public final class WheelTimerScheduler implements MonotonicScheduler {

    private static final long TICK_MILLIS = 100;

    private final Timer timer;
    private final MonotonicClock clock;
    private final boolean ownsTimer;

    public WheelTimerScheduler(Timer timer, MonotonicClock clock) {
        this(timer, clock, false);
    }

    private WheelTimerScheduler(Timer timer, MonotonicClock clock, boolean ownsTimer) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownsTimer = ownsTimer;
    }

    /**
     * Creates a scheduler with its own daemon wheel timer.
     */
    public static WheelTimerScheduler create(MonotonicClock clock) {
        HashedWheelTimer timer = new HashedWheelTimer(
                new DefaultThreadFactory("session-grace-timer", true),
                TICK_MILLIS, TimeUnit.MILLISECONDS);
        return new WheelTimerScheduler(timer, clock, true);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the timer if this scheduler owns it. Pending tasks are dropped.
     */
    public void stop() {
        if (ownsTimer) {
            timer.stop();
        }
    }
}
