package com.questrail.agentsession.internal.log;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Subscription
 * =============================================================================
 * One subscriber's bounded view of a {@link Fanout}.
 *
 * <p>The producer only ever {@code offer}s into the buffer. When the buffer is
 * full the subscription is marked {@link State#LAGGED} and detached: the
 * subscriber keeps whatever was already buffered, then must re-subscribe from
 * its last applied revision to resync.</p>
 */
public final class Subscription<T>
{
    public enum State {
        /** Receiving live items. */
        OPEN,
        /** Dropped for falling behind; re-subscribe to resync. */
        LAGGED,
        /** The producer closed. */
        ENDED,
        /** Cancelled by the subscriber. */
        CANCELLED
    }

    private final BlockingQueue<T> buffer;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private final Consumer<Subscription<T>> onCancel;

    Subscription(int bufferSize, Consumer<Subscription<T>> onCancel) {
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        this.onCancel = onCancel;
    }

    /**
     * Non-blocking enqueue from the producer side.
     *
     * @return {@code false} if the subscription is no longer open or the
     *         buffer is full (in which case it is now {@link State#LAGGED})
     */
    boolean offer(T item) {
        if (state.get() != State.OPEN) {
            return false;
        }
        if (buffer.offer(item)) {
            return true;
        }
        state.compareAndSet(State.OPEN, State.LAGGED);
        return false;
    }

    void end() {
        state.compareAndSet(State.OPEN, State.ENDED);
    }

    /**
     * Waits up to the given time for the next item.
     *
     * @return the next item, or {@code null} if none arrived in time
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return buffer.poll(timeout, unit);
    }

    /**
     * Returns the next buffered item without waiting, or {@code null}.
     */
    public T poll() {
        return buffer.poll();
    }

    /**
     * Removes and returns everything currently buffered.
     */
    public List<T> drain() {
        List<T> out = new ArrayList<>(buffer.size());
        buffer.drainTo(out);
        return out;
    }

    public State state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    /**
     * True once the subscription was dropped for lagging.
     */
    public boolean resyncRequired() {
        return state.get() == State.LAGGED;
    }

    /**
     * Stops delivery to this subscription.
     */
    public void cancel() {
        if (state.compareAndSet(State.OPEN, State.CANCELLED)) {
            onCancel.accept(this);
        }
    }
}
