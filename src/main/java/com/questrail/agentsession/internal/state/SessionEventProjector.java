package com.questrail.agentsession.internal.state;

import com.questrail.agentsession.internal.effects.EventPayload;
import com.questrail.agentsession.internal.effects.SessionEvent;

import java.util.Objects;

/**
 * SessionEventProjector
 * -----------------------------------------------------------------------------
 * Pure fold of {@link SessionEvent}s over a {@link SessionState}.
 *
 * <p>This is the subscriber-side counterpart of {@link SessionTransition}: a
 * viewer that holds a snapshot at revision {@code r} and applies every event
 * after {@code r} arrives at the same state the owning actor holds. Every
 * state change the transition makes is carried by at least one payload, so
 * folding a session's full history over its initial state reproduces the
 * live snapshot exactly.</p>
 *
 * <p>Events at or below the current revision are skipped, which makes
 * overlapping replay batches harmless.</p>
 */
public final class SessionEventProjector
{
    /**
     * Applies all events, in order.
     */
    public SessionState fold(SessionState state, Iterable<SessionEvent> events) {
        Objects.requireNonNull(events, "events");
        SessionState current = state;
        for (SessionEvent event : events) {
            current = apply(current, event);
        }
        return current;
    }

    /**
     * Applies a single event.
     */
    public SessionState apply(SessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (!state.id().equals(event.sessionId())) {
            throw new IllegalArgumentException(
                    "event for session " + event.sessionId() + " applied to " + state.id());
        }
        if (event.revision() <= state.revision()) {
            return state;
        }

        return project(state, event.payload())
                .withRevision(event.revision())
                .withLastActivityAt(event.timestamp());
    }

    private SessionState project(SessionState state, EventPayload payload) {
        if (payload instanceof EventPayload.WorkStatusChanged p) {
            return onWorkStatusChanged(state, p);
        }
        if (payload instanceof EventPayload.MessageAppended p) {
            return state.withMessageAppended(p.message());
        }
        if (payload instanceof EventPayload.MessageUpdated p) {
            return state.withMessageUpdated(p.messageId(), p.changes());
        }
        if (payload instanceof EventPayload.ApprovalRequested p) {
            return state.awaiting(p.request());
        }
        if (payload instanceof EventPayload.TokensUpdated p) {
            return state.withTokenUsage(p.usage());
        }
        if (payload instanceof EventPayload.DiffUpdated p) {
            return state.withCurrentDiff(p.diff());
        }
        if (payload instanceof EventPayload.PlanUpdated p) {
            return state.withCurrentPlan(p.plan());
        }
        if (payload instanceof EventPayload.MetadataChanged p) {
            return state.withMetadata(p.metadata());
        }
        if (payload instanceof EventPayload.TurnDiffRecorded p) {
            return state.withTurnDiffRecorded(p.turnDiff());
        }
        if (payload instanceof EventPayload.SessionEnded p) {
            return state.withPhase(new WorkPhase.Ended(p.reason()));
        }
        if (payload instanceof EventPayload.SessionResumed) {
            return state.withPhase(WorkPhase.idle());
        }

        // ContextCompacted, UndoStarted, UndoCompleted, ThreadRolledBack and
        // ErrorReported are notifications; their phase effect arrives as a
        // separate WorkStatusChanged.
        return state;
    }

    private SessionState onWorkStatusChanged(SessionState state, EventPayload.WorkStatusChanged p) {
        SessionState next = state.withTurn(p.currentTurnId(), p.turnCount());
        return switch (p.workStatus()) {
            case WORKING -> next.withPhase(WorkPhase.working());
            case WAITING -> next.withPhase(WorkPhase.idle());
            // Approval phases arrive with ApprovalRequested, the ended phase
            // with SessionEnded.
            case PERMISSION, QUESTION, ENDED -> next;
        };
    }
}
