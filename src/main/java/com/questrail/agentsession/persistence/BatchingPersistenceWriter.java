package com.questrail.agentsession.persistence;

import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * BatchingPersistenceWriter
 * =============================================================================
 * The shared, bounded, asynchronous write channel between session actors and
 * the {@link SessionStore}.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@link #submit(PersistenceWrite)} never blocks; a full queue rejects</li>
 *   <li>A single writer thread groups queued writes into batches and hands
 *       each batch to the store</li>
 *   <li>A batch is flushed once {@code batchSize} writes are collected or
 *       {@code flushInterval} elapsed since its first write</li>
 *   <li>A failed batch spanning several sessions is retried one session at
 *       a time; only sessions whose own writes still fail are reported</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   writer.start()   → starts the writer thread
 *   writer.submit()  → enqueues a write
 *   writer.close()   → rejects new writes, flushes what is queued, stops
 * </pre>
 */
public final class BatchingPersistenceWriter implements PersistenceSink, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BatchingPersistenceWriter.class);

    private final SessionStore store;
    private final int batchSize;
    private final long flushIntervalNanos;
    private final Duration closeTimeout;
    private final BiConsumer<String, Throwable> failureHandler;
    private final ThreadFactory threadFactory;

    private final BlockingQueue<PersistenceWrite> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Thread writerThread;

    /**
     * @param failureHandler receives the session id and cause for each
     *                       session with writes in a failed batch
     */
    public BatchingPersistenceWriter(SessionStore store,
                                     int queueCapacity,
                                     int batchSize,
                                     Duration flushInterval,
                                     Duration closeTimeout,
                                     BiConsumer<String, Throwable> failureHandler)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (queueCapacity <= 0 || batchSize <= 0) {
            throw new IllegalArgumentException("queueCapacity and batchSize must be > 0");
        }
        this.batchSize = batchSize;
        this.flushIntervalNanos = flushInterval.toNanos();
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.threadFactory = new DefaultThreadFactory("session-persistence", true);
    }

    /**
     * Starts the writer thread. Calling start() again has no effect.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("writer already closed");
        }
        if (running.compareAndSet(false, true)) {
            writerThread = threadFactory.newThread(this::runWriteLoop);
            writerThread.start();
        }
    }

    @Override
    public boolean submit(PersistenceWrite write) {
        Objects.requireNonNull(write, "write");
        if (closed.get()) {
            return false;
        }
        return queue.offer(write);
    }

    public int pendingWrites() {
        return queue.size();
    }

    /**
     * Stops accepting writes, waits for the writer thread to flush what was
     * queued, and flushes any remainder on the calling thread.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        Thread t = writerThread;
        if (t != null) {
            try {
                t.join(closeTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Persistence writer did not stop within {}", closeTimeout);
                t.interrupt();
            }
        }
        List<PersistenceWrite> remainder = new ArrayList<>();
        queue.drainTo(remainder);
        while (!remainder.isEmpty()) {
            int n = Math.min(batchSize, remainder.size());
            flush(new ArrayList<>(remainder.subList(0, n)));
            remainder.subList(0, n).clear();
        }
    }

    // ---------------------------------------------------------------------
    // Writer thread
    // ---------------------------------------------------------------------

    private void runWriteLoop() {
        List<PersistenceWrite> batch = new ArrayList<>(batchSize);
        while (running.get() || !queue.isEmpty()) {
            try {
                collect(batch);
            } catch (InterruptedException e) {
                // Flush what was collected, the rest is drained by close()
                Thread.currentThread().interrupt();
                flush(batch);
                return;
            }
            flush(batch);
            batch.clear();
        }
    }

    private void collect(List<PersistenceWrite> batch) throws InterruptedException {
        PersistenceWrite first = queue.poll(flushIntervalNanos, TimeUnit.NANOSECONDS);
        if (first == null) {
            return;
        }
        batch.add(first);
        long deadline = System.nanoTime() + flushIntervalNanos;
        while (batch.size() < batchSize) {
            queue.drainTo(batch, batchSize - batch.size());
            if (batch.size() >= batchSize || !running.get()) {
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            PersistenceWrite next = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (next == null) {
                return;
            }
            batch.add(next);
        }
    }

    private void flush(List<PersistenceWrite> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            store.write(List.copyOf(batch));
            log.debug("Flushed {} writes", batch.size());
            return;
        } catch (SessionStoreException | RuntimeException e) {
            Map<String, List<PersistenceWrite>> bySession = groupBySession(batch);
            if (bySession.size() == 1) {
                fail(bySession.keySet().iterator().next(), batch.size(), e);
                return;
            }
            log.warn("Failed to flush {} writes for {} sessions, retrying per session",
                    batch.size(), bySession.size(), e);
            bySession.forEach(this::flushSession);
        }
    }

    private void flushSession(String sessionId, List<PersistenceWrite> writes) {
        try {
            store.write(writes);
        } catch (SessionStoreException | RuntimeException e) {
            fail(sessionId, writes.size(), e);
        }
    }

    private void fail(String sessionId, int writes, Exception cause) {
        log.error("Failed to flush {} writes for session {}", writes, sessionId, cause);
        failureHandler.accept(sessionId, cause);
    }

    private static Map<String, List<PersistenceWrite>> groupBySession(List<PersistenceWrite> batch) {
        Map<String, List<PersistenceWrite>> bySession = new LinkedHashMap<>();
        for (PersistenceWrite w : batch) {
            bySession.computeIfAbsent(w.sessionId(), k -> new ArrayList<>()).add(w);
        }
        return bySession;
    }
}
