package com.questrail.agentsession.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SessionCoreConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the session core runtime.
 *
 * <p>These settings bound queues and buffers and control timing. None of them
 * change what a session does in response to an input; that is decided by the
 * transition function alone.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>inboxCapacity</b>: pending inputs a session accepts before routing
 *       fails with {@code BUSY}.</li>
 *   <li><b>eventLogCapacity</b>: events buffered per session for replay.</li>
 *   <li><b>subscriberBufferSize</b>: live events a subscriber may fall behind
 *       before it is dropped and must resync.</li>
 *   <li><b>maxMessagesPerDrain</b>: inbox messages an actor processes before
 *       yielding its executor thread to other sessions.</li>
 *   <li><b>endedSessionGracePeriod</b>: how long an ended session stays
 *       registered (and resumable) before it is removed.</li>
 *   <li><b>persistenceQueueCapacity</b>, <b>persistenceBatchSize</b>,
 *       <b>persistenceFlushInterval</b>: the shared batched write channel.</li>
 *   <li><b>actorThreads</b>: threads shared by all session actors.</li>
 *   <li><b>shutdownTimeout</b>: how long {@code stop()} waits for actors and
 *       the write channel to drain.</li>
 * </ul>
 */
public record SessionCoreConfig(
        int inboxCapacity,
        int eventLogCapacity,
        int subscriberBufferSize,
        int maxMessagesPerDrain,
        Duration endedSessionGracePeriod,
        int persistenceQueueCapacity,
        int persistenceBatchSize,
        Duration persistenceFlushInterval,
        int actorThreads,
        Duration shutdownTimeout
) {
    public static final int DEFAULT_EVENT_LOG_CAPACITY = 1000;

    public SessionCoreConfig {
        Objects.requireNonNull(endedSessionGracePeriod, "endedSessionGracePeriod");
        Objects.requireNonNull(persistenceFlushInterval, "persistenceFlushInterval");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        requirePositive(inboxCapacity, "inboxCapacity");
        requirePositive(eventLogCapacity, "eventLogCapacity");
        requirePositive(subscriberBufferSize, "subscriberBufferSize");
        requirePositive(maxMessagesPerDrain, "maxMessagesPerDrain");
        requirePositive(persistenceQueueCapacity, "persistenceQueueCapacity");
        requirePositive(persistenceBatchSize, "persistenceBatchSize");
        requirePositive(actorThreads, "actorThreads");

        if (endedSessionGracePeriod.isNegative()) {
            throw new IllegalArgumentException("endedSessionGracePeriod must be non-negative");
        }
        if (persistenceFlushInterval.isNegative() || persistenceFlushInterval.isZero()) {
            throw new IllegalArgumentException("persistenceFlushInterval must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    public static SessionCoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    public static final class Builder {
        private int inboxCapacity = 256;
        private int eventLogCapacity = DEFAULT_EVENT_LOG_CAPACITY;
        private int subscriberBufferSize = 512;
        private int maxMessagesPerDrain = 64;
        private Duration endedSessionGracePeriod = Duration.ofMinutes(5);
        private int persistenceQueueCapacity = 4096;
        private int persistenceBatchSize = 50;
        private Duration persistenceFlushInterval = Duration.ofMillis(100);
        private int actorThreads = Runtime.getRuntime().availableProcessors();
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withInboxCapacity(int inboxCapacity) {
            this.inboxCapacity = inboxCapacity;
            return this;
        }

        public Builder withEventLogCapacity(int eventLogCapacity) {
            this.eventLogCapacity = eventLogCapacity;
            return this;
        }

        public Builder withSubscriberBufferSize(int subscriberBufferSize) {
            this.subscriberBufferSize = subscriberBufferSize;
            return this;
        }

        public Builder withMaxMessagesPerDrain(int maxMessagesPerDrain) {
            this.maxMessagesPerDrain = maxMessagesPerDrain;
            return this;
        }

        public Builder withEndedSessionGracePeriod(Duration gracePeriod) {
            this.endedSessionGracePeriod = gracePeriod;
            return this;
        }

        public Builder withPersistenceQueueCapacity(int capacity) {
            this.persistenceQueueCapacity = capacity;
            return this;
        }

        public Builder withPersistenceBatchSize(int batchSize) {
            this.persistenceBatchSize = batchSize;
            return this;
        }

        public Builder withPersistenceFlushInterval(Duration flushInterval) {
            this.persistenceFlushInterval = flushInterval;
            return this;
        }

        public Builder withActorThreads(int actorThreads) {
            this.actorThreads = actorThreads;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public SessionCoreConfig build() {
            return new SessionCoreConfig(
                    inboxCapacity,
                    eventLogCapacity,
                    subscriberBufferSize,
                    maxMessagesPerDrain,
                    endedSessionGracePeriod,
                    persistenceQueueCapacity,
                    persistenceBatchSize,
                    persistenceFlushInterval,
                    actorThreads,
                    shutdownTimeout);
        }
    }
}
