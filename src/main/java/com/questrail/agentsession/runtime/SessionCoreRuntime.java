package com.questrail.agentsession.runtime;

import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.SessionRoutingException;
import com.questrail.agentsession.api.SessionSummary;
import com.questrail.agentsession.config.SessionCoreConfig;
import com.questrail.agentsession.internal.effects.PersistOp;
import com.questrail.agentsession.internal.events.ClientCommand;
import com.questrail.agentsession.internal.events.RuntimeEvent;
import com.questrail.agentsession.internal.exec.DefaultEffectExecutor;
import com.questrail.agentsession.internal.exec.SessionActor;
import com.questrail.agentsession.internal.exec.SessionHandle;
import com.questrail.agentsession.internal.exec.SubscribeResult;
import com.questrail.agentsession.internal.log.EventLog;
import com.questrail.agentsession.internal.log.Fanout;
import com.questrail.agentsession.internal.log.LoggedEvent;
import com.questrail.agentsession.internal.log.SessionEventChannel;
import com.questrail.agentsession.internal.log.SessionEventCodec;
import com.questrail.agentsession.internal.state.SessionState;
import com.questrail.agentsession.internal.state.SessionTransition;
import com.questrail.agentsession.internal.time.Cancellable;
import com.questrail.agentsession.internal.time.MonotonicClock;
import com.questrail.agentsession.internal.time.MonotonicScheduler;
import com.questrail.agentsession.internal.time.SystemMonotonicClock;
import com.questrail.agentsession.internal.time.SystemWallClock;
import com.questrail.agentsession.internal.time.WallClock;
import com.questrail.agentsession.internal.time.WheelTimerScheduler;
import com.questrail.agentsession.observability.InvalidTransitionEvent;
import com.questrail.agentsession.observability.NullObservabilitySink;
import com.questrail.agentsession.observability.SessionErrorEvent;
import com.questrail.agentsession.observability.SessionObservabilitySink;
import com.questrail.agentsession.observability.SessionTransitionEvent;
import com.questrail.agentsession.observability.SubscriberDroppedEvent;
import com.questrail.agentsession.persistence.BatchingPersistenceWriter;
import com.questrail.agentsession.persistence.PersistenceWrite;
import com.questrail.agentsession.persistence.SessionStore;
import com.questrail.agentsession.persistence.SessionStoreException;
import com.questrail.agentsession.registry.ListSubscription;
import com.questrail.agentsession.registry.SessionRegistry;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SessionCoreRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the session core.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   RuntimeConnector ──events──▶ onRuntimeEvent ─┐
 *   clients ─────────commands──▶ send ───────────┼─▶ SessionRegistry ─▶ SessionActor
 *                                                │                        │
 *                                                │      effects ◀─────────┘
 *                         BatchingPersistenceWriter ◀── Persist
 *                         SessionEventChannel     ◀──── Emit
 *                         RuntimeConnector        ◀──── RuntimeCall
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} starts the persistence writer and restores every
 *       session the store reports as active, before any new session is
 *       accepted</li>
 *   <li>Ended sessions stay registered for the configured grace period so
 *       late viewers can still read the final state; a resume within the
 *       window cancels removal</li>
 *   <li>{@link #stop()} stops every actor, flushes outstanding writes and
 *       releases threads</li>
 * </ul>
 */
public final class SessionCoreRuntime
{
    private static final Logger log = LoggerFactory.getLogger(SessionCoreRuntime.class);

    private final SessionCoreConfig config;
    private final SessionStore store;
    private final RuntimeConnector connector;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;
    private final MonotonicScheduler scheduler;
    private final boolean ownsScheduler;
    private final EventExecutorGroup actorGroup;
    private final SessionRegistry registry;
    private final BatchingPersistenceWriter writer;
    private final SessionEventCodec codec = new SessionEventCodec();
    private final SessionTransition transition = new SessionTransition();
    private final SessionObservabilitySink sink;

    private final ConcurrentMap<String, Cancellable> graceTimers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private SessionCoreRuntime(Builder builder) {
        this.config = builder.config;
        this.store = builder.store;
        this.connector = builder.connector;
        this.wallClock = builder.wallClock;
        this.monotonicClock = builder.monotonicClock;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? WheelTimerScheduler.create(monotonicClock) : builder.scheduler;
        this.actorGroup = new DefaultEventExecutorGroup(
                config.actorThreads(), new DefaultThreadFactory("session-actor", true));
        this.registry = new SessionRegistry(config.subscriberBufferSize());
        this.writer = new BatchingPersistenceWriter(
                store,
                config.persistenceQueueCapacity(),
                config.persistenceBatchSize(),
                config.persistenceFlushInterval(),
                config.shutdownTimeout(),
                this::onPersistenceFailure);

        SessionObservabilitySink observabilitySink = builder.observabilitySink;

        // Grace-period bookkeeping rides on the transition stream.
        this.sink = new SessionObservabilitySink() {
            @Override
            public void onStateTransition(SessionTransitionEvent event) {
                observabilitySink.onStateTransition(event);
                if (event.endedSession()) {
                    scheduleRemoval(event.sessionId());
                } else if (event.resumedSession()) {
                    cancelRemoval(event.sessionId());
                }
            }

            @Override public void onInvalidTransition(InvalidTransitionEvent event) { observabilitySink.onInvalidTransition(event); }
            @Override public void onSubscriberDropped(SubscriberDroppedEvent event) { observabilitySink.onSubscriberDropped(event); }
            @Override public void onError(SessionErrorEvent event) { observabilitySink.onError(event); }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the writer and restores active sessions from the store.
     *
     * @throws SessionStoreException if the store cannot list active sessions
     */
    public void start() throws SessionStoreException {
        if (stopped.get()) {
            throw new IllegalStateException("runtime already stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        writer.start();

        List<SessionState> restored;
        try {
            restored = store.loadActiveSessions();
        } catch (SessionStoreException e) {
            running.set(false);
            writer.close();
            throw e;
        }
        for (SessionState state : restored) {
            registry.register(spawn(state));
        }
        log.info("Session core started; restored {} session(s)", restored.size());
    }

    /**
     * Stops all actors, flushes pending writes and releases threads.
     * Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);

        graceTimers.values().forEach(Cancellable::cancel);
        graceTimers.clear();

        List<CompletableFuture<SessionState>> terminations = new ArrayList<>();
        for (SessionHandle handle : registry.handles()) {
            terminations.add(handle.stop());
        }
        long timeoutMillis = config.shutdownTimeout().toMillis();
        try {
            CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not all sessions stopped within {} ms", timeoutMillis, e);
        }

        registry.close();
        writer.close();

        actorGroup.shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(timeoutMillis + 1000);
        if (ownsScheduler) {
            ((WheelTimerScheduler) scheduler).stop();
        }
        log.info("Session core stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /**
     * Creates a session with a generated id.
     */
    public SessionState createSession(SessionMetadata metadata) throws SessionStoreException {
        return createSession(UUID.randomUUID().toString(), metadata);
    }

    /**
     * Persists, spawns and registers a new session.
     *
     * @throws IllegalStateException if the runtime is not running or the id is taken
     * @throws SessionStoreException if the persistence channel rejects the creation
     */
    public SessionState createSession(String sessionId, SessionMetadata metadata) throws SessionStoreException {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(metadata, "metadata");
        requireRunning();
        if (registry.contains(sessionId)) {
            throw new IllegalStateException("session already registered: " + sessionId);
        }

        SessionState initial = SessionState.created(sessionId, metadata);
        if (!writer.submit(new PersistenceWrite(sessionId, initial.revision(), new PersistOp.CreateSession(initial)))) {
            throw new SessionStoreException("persistence channel rejected creation of " + sessionId);
        }
        registry.register(spawn(initial));
        log.info("Created session {} ({}, {})", sessionId, metadata.provider(), metadata.projectPath());
        return initial;
    }

    /**
     * Creates a new session that records {@code sourceSessionId} as its fork
     * origin and inherits its provider, project and configuration.
     */
    public SessionState forkSession(String sourceSessionId)
            throws SessionRoutingException, SessionStoreException
    {
        SessionState source = registry.snapshot(sourceSessionId);
        SessionMetadata origin = source.metadata();
        SessionMetadata forked = SessionMetadata.of(origin.provider(), origin.projectPath(), wallClock.now())
                .withProjectName(origin.projectName())
                .withModel(origin.model())
                .withConfig(origin.approvalPolicy(), origin.sandboxMode())
                .withEnvironment(origin.currentCwd(), origin.gitBranch(), origin.gitSha())
                .withForkedFrom(sourceSessionId);
        return createSession(forked);
    }

    /**
     * Routes a client command to its session.
     */
    public void send(String sessionId, ClientCommand command) throws SessionRoutingException {
        registry.send(sessionId, Objects.requireNonNull(command, "command"));
    }

    /**
     * Entry point for events produced by the {@link RuntimeConnector}.
     */
    public void onRuntimeEvent(String sessionId, RuntimeEvent event) throws SessionRoutingException {
        registry.send(sessionId, Objects.requireNonNull(event, "event"));
    }

    public SessionState snapshot(String sessionId) throws SessionRoutingException {
        return registry.snapshot(sessionId);
    }

    public List<SessionSummary> list() {
        return registry.list();
    }

    public CompletableFuture<SubscribeResult> subscribe(String sessionId, long sinceRevision)
            throws SessionRoutingException
    {
        return registry.subscribe(sessionId, sinceRevision);
    }

    public ListSubscription subscribeList() {
        return registry.subscribeList();
    }

    public SessionRegistry registry() {
        return registry;
    }

    /**
     * Number of persistence writes not yet handed to the store.
     */
    public int pendingWrites() {
        return writer.pendingWrites();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private SessionActor spawn(SessionState state) {
        String sessionId = state.id();
        int bufferSize = config.subscriberBufferSize();
        Fanout<LoggedEvent> fanout = new Fanout<>(bufferSize,
                dropped -> sink.onSubscriberDropped(
                        new SubscriberDroppedEvent(wallClock.now(), sessionId, bufferSize)));
        SessionEventChannel channel = new SessionEventChannel(
                sessionId, codec, new EventLog(config.eventLogCapacity()), fanout);

        return new SessionActor(
                state,
                transition,
                new DefaultEffectExecutor(writer, connector, channel),
                channel,
                actorGroup.next(),
                config,
                wallClock,
                sink);
    }

    private void onPersistenceFailure(String sessionId, Throwable cause) {
        Optional<SessionHandle> handle = registry.handle(sessionId);
        if (handle.isPresent()) {
            handle.get().onPersistenceFailure(cause);
        } else {
            sink.onError(new SessionErrorEvent(wallClock.now(), sessionId, "persistence write failed", cause));
        }
    }

    private void scheduleRemoval(String sessionId) {
        if (stopped.get()) {
            return;
        }
        Cancellable timer = scheduler.scheduleAfter(
                config.endedSessionGracePeriod(), monotonicClock, () -> removeIfEnded(sessionId));
        Cancellable previous = graceTimers.put(sessionId, timer);
        if (previous != null) {
            previous.cancel();
        }
    }

    private void cancelRemoval(String sessionId) {
        Cancellable timer = graceTimers.remove(sessionId);
        if (timer != null) {
            timer.cancel();
        }
    }

    private void removeIfEnded(String sessionId) {
        graceTimers.remove(sessionId);
        Optional<SessionHandle> handle = registry.handle(sessionId);
        if (handle.isEmpty() || !handle.get().snapshot().isEnded()) {
            return;
        }
        if (registry.remove(sessionId, handle.get())) {
            handle.get().stop();
            log.info("Removed ended session {} after grace period", sessionId);
        }
    }

    private void requireRunning() {
        if (!running.get()) {
            throw new IllegalStateException("runtime not running");
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private SessionCoreConfig config = SessionCoreConfig.defaults();
        private SessionStore store;
        private RuntimeConnector connector;
        private SessionObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(SessionCoreConfig config) {
            this.config = config;
            return this;
        }

        public Builder withStore(SessionStore store) {
            this.store = store;
            return this;
        }

        public Builder withRuntimeConnector(RuntimeConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder withObservabilitySink(SessionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock monotonicClock) {
            this.monotonicClock = monotonicClock;
            return this;
        }

        /**
         * Scheduler for grace-period removal. When unset the runtime creates
         * and owns a {@link WheelTimerScheduler}.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public SessionCoreRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(store, "store");
            Objects.requireNonNull(connector, "connector");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            return new SessionCoreRuntime(this);
        }
    }
}
