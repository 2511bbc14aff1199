package com.questrail.agentsession.internal.exec;

import com.questrail.agentsession.api.SessionRoutingException;
import com.questrail.agentsession.config.SessionCoreConfig;
import com.questrail.agentsession.internal.effects.Effect;
import com.questrail.agentsession.internal.events.RuntimeEvent;
import com.questrail.agentsession.internal.events.SessionInput;
import com.questrail.agentsession.internal.log.SessionEventChannel;
import com.questrail.agentsession.internal.state.SessionState;
import com.questrail.agentsession.internal.state.SessionTransition;
import com.questrail.agentsession.internal.time.WallClock;
import com.questrail.agentsession.observability.InvalidTransitionEvent;
import com.questrail.agentsession.observability.NullObservabilitySink;
import com.questrail.agentsession.observability.SessionErrorEvent;
import com.questrail.agentsession.observability.SessionObservabilitySink;
import com.questrail.agentsession.observability.SessionTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SessionActor
 * =============================================================================
 * Exclusive owner of one session's state.
 *
 * <h2>Purpose</h2>
 * The actor provides the serialized runtime behavior for a session:
 * <ul>
 *   <li>One inbox merging runtime events, client commands and subscribe requests</li>
 *   <li>Strictly one message at a time, in arrival order</li>
 *   <li>Transition via {@link SessionTransition}, then each effect in order</li>
 *   <li>Publication of an immutable snapshot for concurrent readers</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Actors do not own threads. Each actor is pinned to one {@link Executor}
 * (typically a Netty {@code EventExecutor} shared with other sessions) and
 * schedules a drain task whenever its inbox becomes non-empty. A drain
 * processes at most {@code maxMessagesPerDrain} messages, then yields the
 * thread and reschedules itself if more are waiting. At most one drain task
 * per actor exists at any time, so the session state never sees concurrent
 * access and needs no lock.
 *
 * <h2>Back-pressure</h2>
 * The inbox is bounded for inputs routed from outside: {@link #tell} fails
 * fast with {@code BUSY} once {@code inboxCapacity} inputs are pending.
 * Effect-failure feedback and subscribe requests bypass the bound so an
 * error report is never lost.
 *
 * <h2>Failure handling</h2>
 * A failed effect is reported to the observability sink and re-submitted to
 * this actor as a {@link RuntimeEvent.Error}: origin {@code PERSISTENCE} for
 * a rejected or failed write, {@code EFFECT} otherwise. A failure while
 * executing the effects of such an error is reported only, and a
 * {@code PERSISTENCE} error writes nothing, so a broken store cannot loop.
 * The actor never stops because of a failure; only {@link #stop()} ends it.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   actor.tell(input)       → enqueues an input
 *   actor.subscribe(since)  → replay or snapshot, then live events
 *   actor.stop()            → processes what is queued, closes subscriptions
 * </pre>
 */
public final class SessionActor implements SessionHandle
{
    private static final Logger log = LoggerFactory.getLogger(SessionActor.class);
    private static final String PERSISTENCE_FAILED = "persistence write failed";

    // ---------------------------------------------------------------------
    // Mailbox messages
    // ---------------------------------------------------------------------

    private sealed interface Mail permits Deliver, Subscribe, Stop {}

    /**
     * @param counted whether the input occupies inbox capacity
     */
    private record Deliver(SessionInput input, boolean counted) implements Mail {}

    private record Subscribe(long sinceRevision, CompletableFuture<SubscribeResult> reply) implements Mail {}

    private record Stop(CompletableFuture<SessionState> reply) implements Mail {}

    // ---------------------------------------------------------------------

    private final String sessionId;
    private final SessionTransition transition;
    private final EffectExecutor effectExecutor;
    private final SessionEventChannel channel;
    private final Executor executor;
    private final WallClock wallClock;
    private final SessionObservabilitySink observabilitySink;
    private final int inboxCapacity;
    private final int maxMessagesPerDrain;

    private final Queue<Mail> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingInputs = new AtomicInteger();
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<SessionState> published;
    private final CompletableFuture<SessionState> terminated = new CompletableFuture<>();

    // Confined to the drain task.
    private SessionState state;
    private boolean stopped;

    public SessionActor(SessionState initialState,
                        SessionTransition transition,
                        EffectExecutor effectExecutor,
                        SessionEventChannel channel,
                        Executor executor,
                        SessionCoreConfig config,
                        WallClock wallClock,
                        SessionObservabilitySink observabilitySink)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.sessionId = initialState.id();
        this.transition = Objects.requireNonNull(transition, "transition");
        this.effectExecutor = Objects.requireNonNull(effectExecutor, "effectExecutor");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        Objects.requireNonNull(config, "config");
        this.inboxCapacity = config.inboxCapacity();
        this.maxMessagesPerDrain = config.maxMessagesPerDrain();
        this.published = new AtomicReference<>(initialState);
    }

    // ---------------------------------------------------------------------
    // SessionHandle
    // ---------------------------------------------------------------------

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public void tell(SessionInput input) throws SessionRoutingException {
        Objects.requireNonNull(input, "input");
        if (stopRequested.get()) {
            throw new SessionRoutingException(sessionId, SessionRoutingException.Reason.CLOSED);
        }
        if (pendingInputs.incrementAndGet() > inboxCapacity) {
            pendingInputs.decrementAndGet();
            throw new SessionRoutingException(sessionId, SessionRoutingException.Reason.BUSY);
        }
        if (!enqueue(new Deliver(input, true))) {
            pendingInputs.decrementAndGet();
            throw new SessionRoutingException(sessionId, SessionRoutingException.Reason.CLOSED);
        }
    }

    @Override
    public CompletableFuture<SubscribeResult> subscribe(long sinceRevision) {
        CompletableFuture<SubscribeResult> reply = new CompletableFuture<>();
        if (stopRequested.get() || !enqueue(new Subscribe(sinceRevision, reply))) {
            reply.completeExceptionally(
                    new SessionRoutingException(sessionId, SessionRoutingException.Reason.CLOSED));
        }
        return reply;
    }

    @Override
    public SessionState snapshot() {
        return published.get();
    }

    @Override
    public CompletableFuture<SessionState> stop() {
        if (stopRequested.compareAndSet(false, true)) {
            if (!enqueue(new Stop(terminated))) {
                // Executor already gone: nothing can run any more.
                terminated.complete(published.get());
            }
        }
        return terminated;
    }

    @Override
    public boolean isStopped() {
        return terminated.isDone();
    }

    /**
     * Effect failures reported asynchronously (runtime calls, persistence
     * batches) come back here from any thread.
     */
    @Override
    public void onEffectFailure(String description, Throwable cause) {
        observabilitySink.onError(new SessionErrorEvent(wallClock.now(), sessionId, description, cause));
        feedback(RuntimeEvent.Error.Origin.EFFECT, description, cause);
    }

    @Override
    public void onPersistenceFailure(Throwable cause) {
        observabilitySink.onError(new SessionErrorEvent(wallClock.now(), sessionId, PERSISTENCE_FAILED, cause));
        feedback(RuntimeEvent.Error.Origin.PERSISTENCE, PERSISTENCE_FAILED, cause);
    }

    /**
     * Number of routed inputs waiting in the inbox.
     */
    public int pendingInputs() {
        return pendingInputs.get();
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    private boolean enqueue(Mail mail) {
        inbox.add(mail);
        try {
            scheduleDrain();
            return true;
        } catch (RejectedExecutionException e) {
            inbox.remove(mail);
            return false;
        }
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                drainScheduled.set(false);
                throw e;
            }
        }
    }

    private void drain() {
        int processed = 0;
        try {
            Mail mail;
            while (processed < maxMessagesPerDrain && (mail = inbox.poll()) != null) {
                processed++;
                process(mail);
            }
        } finally {
            drainScheduled.set(false);
            if (!inbox.isEmpty()) {
                try {
                    scheduleDrain();
                } catch (RejectedExecutionException e) {
                    log.warn("Session {}: executor rejected drain, {} messages left", sessionId, inbox.size());
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Processing (drain task only)
    // ---------------------------------------------------------------------

    private void process(Mail mail) {
        try {
            if (mail instanceof Deliver d) {
                if (d.counted()) {
                    pendingInputs.decrementAndGet();
                }
                onDeliver(d.input());
            } else if (mail instanceof Subscribe s) {
                onSubscribe(s);
            } else if (mail instanceof Stop s) {
                onStop(s);
            }
        } catch (Exception e) {
            observabilitySink.onError(new SessionErrorEvent(
                    wallClock.now(), sessionId, "Message processing error", e));
        }
    }

    private void onDeliver(SessionInput input) {
        if (stopped) {
            log.debug("Session {}: dropped {} after stop", sessionId, input.kind());
            return;
        }

        Instant now = wallClock.now();
        SessionState oldState = state;
        SessionTransition.Result result = transition.apply(oldState, input, now);

        if (result.isRejected()) {
            observabilitySink.onInvalidTransition(new InvalidTransitionEvent(
                    now, sessionId, oldState.phase(), input, result.rejection()));
            return;
        }

        state = result.newState();

        EffectExecutionException firstFailure = null;
        RuntimeEvent.Error.Origin failureOrigin = null;
        for (Effect effect : result.effects().list()) {
            try {
                CompletionStage<Void> stage = effectExecutor.execute(state, effect);
                watch(stage, effect, input);
            } catch (EffectExecutionException e) {
                observabilitySink.onError(new SessionErrorEvent(now, sessionId, e.getMessage(), e));
                if (firstFailure == null) {
                    firstFailure = e;
                    failureOrigin = effect instanceof Effect.Persist
                            ? RuntimeEvent.Error.Origin.PERSISTENCE
                            : RuntimeEvent.Error.Origin.EFFECT;
                }
            }
        }

        published.set(state);

        observabilitySink.onStateTransition(new SessionTransitionEvent(
                now, oldState, state, input, result.effects()));

        if (firstFailure != null && !isEffectError(input)) {
            feedback(failureOrigin, firstFailure.getMessage(), firstFailure);
        }
    }

    private void watch(CompletionStage<Void> stage, Effect effect, SessionInput input) {
        if (!(effect instanceof Effect.RuntimeCall call)) {
            return;
        }
        boolean mayFeedBack = !isEffectError(input);
        stage.whenComplete((ignored, error) -> {
            if (error == null) {
                return;
            }
            String description = "runtime call " + call.command().getClass().getSimpleName() + " failed";
            observabilitySink.onError(new SessionErrorEvent(wallClock.now(), sessionId, description, error));
            if (mayFeedBack) {
                feedback(RuntimeEvent.Error.Origin.EFFECT, description, error);
            }
        });
    }

    private void onSubscribe(Subscribe request) {
        if (stopped) {
            request.reply().completeExceptionally(
                    new SessionRoutingException(sessionId, SessionRoutingException.Reason.CLOSED));
            return;
        }
        SessionEventChannel.Attachment attachment = channel.attach(request.sinceRevision(), state.revision());
        SubscribeResult result = attachment.replay()
                .<SubscribeResult>map(events -> new SubscribeResult.Replay(events, attachment.live()))
                .orElseGet(() -> new SubscribeResult.Snapshot(state, attachment.live()));
        if (!request.reply().complete(result)) {
            // Requester gave up waiting.
            attachment.live().cancel();
        }
    }

    private void onStop(Stop request) {
        if (stopped) {
            return;
        }
        stopped = true;
        channel.close();
        published.set(state);
        request.reply().complete(state);
    }

    private void feedback(RuntimeEvent.Error.Origin origin, String description, Throwable cause) {
        if (stopRequested.get()) {
            return;
        }
        String message = cause != null && cause.getMessage() != null && !cause.getMessage().equals(description)
                ? description + ": " + cause.getMessage()
                : description;
        enqueue(new Deliver(new RuntimeEvent.Error(message, origin), false));
    }

    private static boolean isEffectError(SessionInput input) {
        return input instanceof RuntimeEvent.Error e && e.origin() != RuntimeEvent.Error.Origin.RUNTIME;
    }
}
