package com.questrail.agentsession.internal.log;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fanout
 * =============================================================================
 * Non-blocking one-to-many delivery.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #publish(Object)} performs one non-blocking offer per subscriber</li>
 *   <li>A subscriber whose buffer is full is detached and reported to the
 *       lag listener; nobody else is affected</li>
 *   <li>Subscribers attach and detach concurrently with publishing</li>
 * </ul>
 *
 * Publishing is expected from a single producer at a time (the owning
 * actor). Attach and cancel may happen from any thread.
 */
public final class Fanout<T>
{
    private final int bufferSize;
    private final Consumer<Subscription<T>> lagListener;
    private final List<Subscription<T>> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public Fanout(int bufferSize, Consumer<Subscription<T>> lagListener) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0");
        }
        this.bufferSize = bufferSize;
        this.lagListener = Objects.requireNonNull(lagListener, "lagListener");
    }

    /**
     * Attaches a new subscriber. Items published from now on are delivered to it.
     * Attaching to a closed fan-out yields an already ended subscription.
     */
    public Subscription<T> subscribe() {
        Subscription<T> sub = new Subscription<>(bufferSize, subscribers::remove);
        subscribers.add(sub);
        if (closed) {
            subscribers.remove(sub);
            sub.end();
        }
        return sub;
    }

    /**
     * Delivers the item to every open subscriber without blocking.
     */
    public void publish(T item) {
        Objects.requireNonNull(item, "item");
        for (Subscription<T> sub : subscribers) {
            if (!sub.offer(item)) {
                subscribers.remove(sub);
                if (sub.resyncRequired()) {
                    lagListener.accept(sub);
                }
            }
        }
    }

    /**
     * Ends every subscription. Buffered items stay readable.
     */
    public void close() {
        closed = true;
        for (Subscription<T> sub : subscribers) {
            sub.end();
        }
        subscribers.clear();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
