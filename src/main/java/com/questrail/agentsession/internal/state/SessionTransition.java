package com.questrail.agentsession.internal.state;

import com.questrail.agentsession.api.ApprovalDecision;
import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.api.ApprovalType;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageType;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.TurnDiff;
import com.questrail.agentsession.internal.effects.Effects;
import com.questrail.agentsession.internal.effects.EventPayload;
import com.questrail.agentsession.internal.effects.PersistOp;
import com.questrail.agentsession.internal.effects.RuntimeCommand;
import com.questrail.agentsession.internal.events.ClientCommand;
import com.questrail.agentsession.internal.events.RuntimeEvent;
import com.questrail.agentsession.internal.events.SessionInput;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * SessionTransition
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one agent session.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link SessionState}, a single {@link SessionInput} and the
 * time at which the input is processed, the transition computes:
 * <ul>
 *   <li>a new {@link SessionState}</li>
 *   <li>an ordered list of {@link Effects} describing what must happen next</li>
 * </ul>
 *
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no clocks, no randomness)</li>
 *   <li>Deterministic: equal arguments always produce equal results</li>
 *   <li>Total: every (phase, input) pair has a defined outcome</li>
 * </ul>
 *
 * <h2>Invalid transitions</h2>
 * An input that does not apply to the current phase yields a
 * {@link Result#isRejected() rejected} result: the state is returned
 * unchanged, no effects are produced, and the reason is reported to the
 * caller for logging.
 *
 * <h2>Revisions</h2>
 * A step that emits {@code n} events advances the revision by exactly
 * {@code n} and stamps {@code lastActivityAt} with the processing time.
 * Steps without emissions leave both untouched.
 */
public final class SessionTransition
{
    /** Reason recorded when the user ends a session. */
    public static final String USER_REQUESTED = "user_requested";

    /** Decision value persisted for answered questions. */
    public static final String ANSWERED = "answered";

    private static final int ECHO_WINDOW = 5;

    /**
     * Result of applying an input to a session state.
     *
     * @param newState  the updated state
     * @param effects   effects to execute, in order
     * @param rejection reason the input was rejected, or {@code null}
     */
    public record Result(SessionState newState, Effects effects, String rejection)
    {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(effects, "effects");
        }

        static Result unchanged(SessionState state) {
            return new Result(state, Effects.none(), null);
        }

        static Result rejected(SessionState state, String reason) {
            return new Result(state, Effects.none(), reason);
        }

        public boolean isRejected() {
            return rejection != null;
        }
    }

    /**
     * Applies a single input to the current session state.
     *
     * @param state the current state (must not be {@code null})
     * @param input the input to apply (must not be {@code null})
     * @param now   processing time, supplied by the caller
     * @return the resulting state and effects
     */
    public Result apply(SessionState state, SessionInput input, Instant now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(now, "now");

        Result result = dispatch(state, input, now);
        if (result.isRejected() || result.effects().emitCount() == 0) {
            return result;
        }

        SessionState next = result.newState()
                .withRevision(state.revision() + result.effects().emitCount())
                .withLastActivityAt(now);
        return new Result(next, result.effects(), null);
    }

    private Result dispatch(SessionState state, SessionInput input, Instant now) {
        // Runtime events
        if (input instanceof RuntimeEvent.TurnStarted) {
            return onTurnStarted(state, input, now);
        }
        if (input instanceof RuntimeEvent.TurnCompleted) {
            return onTurnCompleted(state, input, now);
        }
        if (input instanceof RuntimeEvent.TurnAborted) {
            return onTurnAborted(state, input, now);
        }
        if (input instanceof RuntimeEvent.Error e) {
            return onError(state, e, now);
        }
        if (input instanceof RuntimeEvent.MessageCreated e) {
            return onMessageCreated(state, e, now);
        }
        if (input instanceof RuntimeEvent.MessageUpdated e) {
            return onMessageUpdated(state, e, now);
        }
        if (input instanceof RuntimeEvent.ApprovalRequested e) {
            return onApprovalRequested(state, e, now);
        }
        if (input instanceof RuntimeEvent.TokensUpdated e) {
            return onTokensUpdated(state, e, now);
        }
        if (input instanceof RuntimeEvent.DiffUpdated e) {
            return onDiffUpdated(state, e, now);
        }
        if (input instanceof RuntimeEvent.PlanUpdated e) {
            return onPlanUpdated(state, e, now);
        }
        if (input instanceof RuntimeEvent.NameUpdated e) {
            return onMetadataUpdated(state, input, state.metadata().withCustomName(e.name()), now);
        }
        if (input instanceof RuntimeEvent.ModelUpdated e) {
            return onMetadataUpdated(state, input, state.metadata().withModel(e.model()), now);
        }
        if (input instanceof RuntimeEvent.EnvironmentChanged e) {
            return onEnvironmentChanged(state, e, now);
        }
        if (input instanceof RuntimeEvent.SessionEnded e) {
            return onSessionEnded(state, input, e.reason(), null, now);
        }
        if (input instanceof RuntimeEvent.ContextCompacted) {
            return onContextCompacted(state, input, now);
        }
        if (input instanceof RuntimeEvent.UndoStarted e) {
            return onUndoStarted(state, e, now);
        }
        if (input instanceof RuntimeEvent.UndoCompleted e) {
            return onBackToIdle(state, input, new EventPayload.UndoCompleted(e.success(), e.message()), now);
        }
        if (input instanceof RuntimeEvent.ThreadRolledBack e) {
            return onBackToIdle(state, input, new EventPayload.ThreadRolledBack(e.numTurns()), now);
        }

        // Client commands
        if (input instanceof ClientCommand.UserSentMessage c) {
            return onUserSentMessage(state, c, now);
        }
        if (input instanceof ClientCommand.UserSteered c) {
            return onUserSteered(state, c, now);
        }
        if (input instanceof ClientCommand.UserApproved c) {
            return onUserApproved(state, c, now);
        }
        if (input instanceof ClientCommand.UserAnsweredQuestion c) {
            return onUserAnsweredQuestion(state, c, now);
        }
        if (input instanceof ClientCommand.UserRenamed c) {
            return onUserMetadataCommand(state, input,
                    state.metadata().withCustomName(c.name()),
                    new RuntimeCommand.SetThreadName(c.name()), now);
        }
        if (input instanceof ClientCommand.UserChangedConfig c) {
            SessionMetadata current = state.metadata();
            String policy = c.approvalPolicy() != null ? c.approvalPolicy() : current.approvalPolicy();
            String sandbox = c.sandboxMode() != null ? c.sandboxMode() : current.sandboxMode();
            return onUserMetadataCommand(state, input,
                    current.withConfig(policy, sandbox),
                    new RuntimeCommand.UpdateConfig(policy, sandbox), now);
        }
        if (input instanceof ClientCommand.UserInterrupted) {
            return onUserInterrupted(state, input, now);
        }
        if (input instanceof ClientCommand.UserCompacted) {
            return onUserStartsWork(state, input, new RuntimeCommand.Compact(), now);
        }
        if (input instanceof ClientCommand.UserUndo) {
            return onUserStartsWork(state, input, new RuntimeCommand.Undo(), now);
        }
        if (input instanceof ClientCommand.UserRolledBack c) {
            if (c.numTurns() < 1) {
                return Result.rejected(state, "rollback requires at least one turn");
            }
            return onUserStartsWork(state, input, new RuntimeCommand.Rollback(c.numTurns()), now);
        }
        if (input instanceof ClientCommand.UserEnded) {
            return onSessionEnded(state, input, USER_REQUESTED, new RuntimeCommand.Shutdown(), now);
        }
        if (input instanceof ClientCommand.Resume) {
            return onResume(state, input, now);
        }

        return invalid(state, input);
    }

    // ---------------------------------------------------------------------
    // Turn lifecycle
    // ---------------------------------------------------------------------

    private Result onTurnStarted(SessionState state, SessionInput input, Instant now) {
        if (!isIdle(state) && !isWorking(state)) {
            return invalid(state, input);
        }
        long count = state.turnCount() + 1;
        SessionState next = state
                .withPhase(WorkPhase.working())
                .withTurn("turn-" + count, count);

        return new Result(next, statusChange(state, next, now).build(), null);
    }

    private Result onTurnCompleted(SessionState state, SessionInput input, Instant now) {
        if (!isWorking(state)) {
            return invalid(state, input);
        }
        Effects.Builder b = Effects.builder(state.revision(), now);
        SessionState next = state;

        if (state.currentTurnId() != null && state.currentDiff() != null) {
            TurnDiff snapshot = new TurnDiff(state.currentTurnId(), state.currentDiff(), state.tokenUsage());
            next = next.withTurnDiffRecorded(snapshot);
            b.persist(new PersistOp.InsertTurnDiff(snapshot))
             .emit(new EventPayload.TurnDiffRecorded(snapshot));
        }

        next = next.withPhase(WorkPhase.idle()).withTurn(null, state.turnCount());
        appendStatusChange(b, next, now);
        return new Result(next, b.build(), null);
    }

    private Result onTurnAborted(SessionState state, SessionInput input, Instant now) {
        if (!isWorking(state) && !isAwaiting(state)) {
            return invalid(state, input);
        }
        SessionState next = state
                .withPhase(WorkPhase.idle())
                .withTurn(null, state.turnCount());
        return new Result(next, statusChange(state, next, now).build(), null);
    }

    /*
     * Error recovery: a busy session falls back to Idle, an idle one only
     * reports. Every error step persists the session status so the stored
     * revision keeps up with the live one, except when the failure came from
     * the persistence path itself.
     */
    private Result onError(SessionState state, RuntimeEvent.Error e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        Effects.Builder b = Effects.builder(state.revision(), now);
        boolean persist = e.origin() != RuntimeEvent.Error.Origin.PERSISTENCE;

        if (isIdle(state)) {
            if (persist) {
                b.persist(statusOp(state, now));
            }
            b.emit(new EventPayload.ErrorReported(e.message()));
            return new Result(state, b.build(), null);
        }

        SessionState next = state
                .withPhase(WorkPhase.idle())
                .withTurn(null, state.turnCount());
        if (persist) {
            b.persist(statusOp(next, now));
        }
        b.emit(new EventPayload.ErrorReported(e.message()));
        b.emit(workStatusChanged(next));
        return new Result(next, b.build(), null);
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    private Result onMessageCreated(SessionState state, RuntimeEvent.MessageCreated e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        Message message = e.message().withSessionId(state.id());
        if (isUserEcho(state, message)) {
            return Result.unchanged(state);
        }
        SessionState next = state.withMessageAppended(message);
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.AppendMessage(message))
                .emit(new EventPayload.MessageAppended(message))
                .build();
        return new Result(next, effects, null);
    }

    private boolean isUserEcho(SessionState state, Message message) {
        if (message.type() != MessageType.USER) {
            return false;
        }
        int seen = 0;
        List<Message> messages = state.messages();
        for (int i = messages.size() - 1; i >= 0 && seen < ECHO_WINDOW; i--) {
            Message m = messages.get(i);
            if (m.type() != MessageType.USER) {
                continue;
            }
            seen++;
            if (m.content().equals(message.content())) {
                return true;
            }
        }
        return false;
    }

    private Result onMessageUpdated(SessionState state, RuntimeEvent.MessageUpdated e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        SessionState next = state.withMessageUpdated(e.messageId(), e.changes());
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.UpdateMessage(e.messageId(), e.changes()))
                .emit(new EventPayload.MessageUpdated(e.messageId(), e.changes()))
                .build();
        return new Result(next, effects, null);
    }

    // ---------------------------------------------------------------------
    // Approvals
    // ---------------------------------------------------------------------

    private Result onApprovalRequested(SessionState state, RuntimeEvent.ApprovalRequested e, Instant now) {
        if (!isWorking(state)) {
            return invalid(state, e);
        }
        if (e.requestId() == null || e.requestId().isBlank()) {
            return Result.rejected(state, "approval request without request id");
        }
        ApprovalRequest request = new ApprovalRequest(
                e.requestId(), state.id(), e.approvalType(), e.command(),
                e.filePath(), e.diff(), e.question(), e.proposedAmendment());

        SessionState next = state.awaiting(request);
        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.RecordApprovalRequest(request))
                .persist(statusOp(next, now))
                .emit(new EventPayload.ApprovalRequested(request))
                .emit(workStatusChanged(next));
        return new Result(next, b.build(), null);
    }

    private Result onUserApproved(SessionState state, ClientCommand.UserApproved c, Instant now) {
        if (!(state.phase() instanceof WorkPhase.AwaitingApproval awaiting)
                || !awaiting.requestId().equals(c.requestId())) {
            return invalid(state, c);
        }
        ApprovalDecision decision = c.decision();
        SessionState next = decision.isApproved()
                ? state.withPhase(WorkPhase.working())
                : state.withPhase(WorkPhase.idle()).withTurn(null, state.turnCount());

        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.RecordApprovalDecision(c.requestId(), decision.wireValue()));
        appendStatusChange(b, next, now);
        b.runtimeCall(new RuntimeCommand.Approve(
                c.requestId(), awaiting.approvalType(), decision, awaiting.proposedAmendment()));
        return new Result(next, b.build(), null);
    }

    private Result onUserAnsweredQuestion(SessionState state, ClientCommand.UserAnsweredQuestion c, Instant now) {
        if (!(state.phase() instanceof WorkPhase.AwaitingApproval awaiting)
                || awaiting.approvalType() != ApprovalType.QUESTION
                || !awaiting.requestId().equals(c.requestId())) {
            return invalid(state, c);
        }
        SessionState next = state.withPhase(WorkPhase.working());
        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.RecordApprovalDecision(c.requestId(), ANSWERED));
        appendStatusChange(b, next, now);
        b.runtimeCall(new RuntimeCommand.AnswerQuestion(c.requestId(), c.answer()));
        return new Result(next, b.build(), null);
    }

    // ---------------------------------------------------------------------
    // Token usage, diff, plan, metadata
    // ---------------------------------------------------------------------

    private Result onTokensUpdated(SessionState state, RuntimeEvent.TokensUpdated e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        SessionState next = state.withTokenUsage(e.usage());
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.UpdateTokenUsage(e.usage()))
                .emit(new EventPayload.TokensUpdated(e.usage()))
                .build();
        return new Result(next, effects, null);
    }

    private Result onDiffUpdated(SessionState state, RuntimeEvent.DiffUpdated e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        SessionState next = state.withCurrentDiff(e.diff());
        Effects effects = Effects.builder(state.revision(), now)
                .persist(turnState(next))
                .emit(new EventPayload.DiffUpdated(e.diff()))
                .build();
        return new Result(next, effects, null);
    }

    private Result onPlanUpdated(SessionState state, RuntimeEvent.PlanUpdated e, Instant now) {
        if (state.isEnded()) {
            return invalid(state, e);
        }
        SessionState next = state.withCurrentPlan(e.plan());
        Effects effects = Effects.builder(state.revision(), now)
                .persist(turnState(next))
                .emit(new EventPayload.PlanUpdated(e.plan()))
                .build();
        return new Result(next, effects, null);
    }

    private Result onMetadataUpdated(SessionState state, SessionInput input,
                                     SessionMetadata updated, Instant now) {
        if (state.isEnded()) {
            return invalid(state, input);
        }
        if (updated.equals(state.metadata())) {
            return Result.unchanged(state);
        }
        SessionState next = state.withMetadata(updated);
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.UpdateMetadata(updated))
                .emit(new EventPayload.MetadataChanged(updated))
                .build();
        return new Result(next, effects, null);
    }

    private Result onEnvironmentChanged(SessionState state, RuntimeEvent.EnvironmentChanged e, Instant now) {
        SessionMetadata current = state.metadata();
        SessionMetadata updated = current.withEnvironment(
                e.cwd() != null ? e.cwd() : current.currentCwd(),
                e.gitBranch() != null ? e.gitBranch() : current.gitBranch(),
                e.gitSha() != null ? e.gitSha() : current.gitSha());
        return onMetadataUpdated(state, e, updated, now);
    }

    private Result onUserMetadataCommand(SessionState state, SessionInput input,
                                         SessionMetadata updated, RuntimeCommand command,
                                         Instant now) {
        if (state.isEnded()) {
            return invalid(state, input);
        }
        SessionState next = state.withMetadata(updated);
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.UpdateMetadata(updated))
                .runtimeCall(command)
                .emit(new EventPayload.MetadataChanged(updated))
                .build();
        return new Result(next, effects, null);
    }

    // ---------------------------------------------------------------------
    // Undo, rollback, compaction
    // ---------------------------------------------------------------------

    private Result onContextCompacted(SessionState state, SessionInput input, Instant now) {
        if (state.isEnded()) {
            return invalid(state, input);
        }
        Effects effects = Effects.builder(state.revision(), now)
                .persist(statusOp(state, now))
                .emit(new EventPayload.ContextCompacted())
                .build();
        return new Result(state, effects, null);
    }

    private Result onUndoStarted(SessionState state, RuntimeEvent.UndoStarted e, Instant now) {
        if (!isIdle(state) && !isWorking(state)) {
            return invalid(state, e);
        }
        SessionState next = state.withPhase(WorkPhase.working());
        Effects.Builder b = statusChange(state, next, now)
                .emit(new EventPayload.UndoStarted(e.message()));
        return new Result(next, b.build(), null);
    }

    private Result onBackToIdle(SessionState state, SessionInput input, EventPayload payload, Instant now) {
        if (!isIdle(state) && !isWorking(state)) {
            return invalid(state, input);
        }
        SessionState next = state
                .withPhase(WorkPhase.idle())
                .withTurn(null, state.turnCount());
        Effects.Builder b = statusChange(state, next, now).emit(payload);
        return new Result(next, b.build(), null);
    }

    // ---------------------------------------------------------------------
    // User driven work
    // ---------------------------------------------------------------------

    private Result onUserSentMessage(SessionState state, ClientCommand.UserSentMessage c, Instant now) {
        if (!isIdle(state)) {
            return invalid(state, c);
        }
        Message message = Message.user(c.messageId(), state.id(), c.content(), now);
        SessionState next = state.withMessageAppended(message);

        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.AppendMessage(message))
                .emit(new EventPayload.MessageAppended(message));

        if (c.model() != null && !c.model().equals(state.metadata().model())) {
            SessionMetadata updated = state.metadata().withModel(c.model());
            next = next.withMetadata(updated);
            b.persist(new PersistOp.UpdateMetadata(updated))
             .emit(new EventPayload.MetadataChanged(updated));
        }

        next = next.withPhase(WorkPhase.working());
        appendStatusChange(b, next, now);
        b.runtimeCall(new RuntimeCommand.SendMessage(c.content(), c.model(), c.effort()));
        return new Result(next, b.build(), null);
    }

    private Result onUserSteered(SessionState state, ClientCommand.UserSteered c, Instant now) {
        boolean idle = isIdle(state);
        if (!idle && !isWorking(state)) {
            return invalid(state, c);
        }
        Message message = Message.user(c.messageId(), state.id(), c.content(), now);
        SessionState next = state.withMessageAppended(message);

        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.AppendMessage(message))
                .emit(new EventPayload.MessageAppended(message));
        if (idle) {
            next = next.withPhase(WorkPhase.working());
            appendStatusChange(b, next, now);
        }
        b.runtimeCall(new RuntimeCommand.SteerTurn(c.content(), c.messageId()));
        return new Result(next, b.build(), null);
    }

    private Result onUserInterrupted(SessionState state, SessionInput input, Instant now) {
        if (!isWorking(state) && !isAwaiting(state)) {
            return invalid(state, input);
        }
        Effects effects = Effects.builder(state.revision(), now)
                .runtimeCall(new RuntimeCommand.Interrupt())
                .build();
        return new Result(state, effects, null);
    }

    private Result onUserStartsWork(SessionState state, SessionInput input,
                                    RuntimeCommand command, Instant now) {
        if (!isIdle(state)) {
            return invalid(state, input);
        }
        SessionState next = state.withPhase(WorkPhase.working());
        Effects.Builder b = statusChange(state, next, now).runtimeCall(command);
        return new Result(next, b.build(), null);
    }

    // ---------------------------------------------------------------------
    // End and resume
    // ---------------------------------------------------------------------

    private Result onSessionEnded(SessionState state, SessionInput input, String reason,
                                  RuntimeCommand command, Instant now) {
        if (state.isEnded()) {
            return invalid(state, input);
        }
        SessionState next = state.withPhase(new WorkPhase.Ended(reason));
        Effects.Builder b = Effects.builder(state.revision(), now)
                .persist(new PersistOp.EndSession(reason, now))
                .emit(new EventPayload.SessionEnded(reason));
        if (command != null) {
            b.runtimeCall(command);
        }
        return new Result(next, b.build(), null);
    }

    private Result onResume(SessionState state, SessionInput input, Instant now) {
        if (!state.isEnded()) {
            return invalid(state, input);
        }
        SessionState next = state.withPhase(WorkPhase.idle());
        Effects effects = Effects.builder(state.revision(), now)
                .persist(new PersistOp.ReactivateSession(now))
                .emit(new EventPayload.SessionResumed())
                .build();
        return new Result(next, effects, null);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Effects.Builder statusChange(SessionState before, SessionState next, Instant now) {
        Effects.Builder b = Effects.builder(before.revision(), now);
        appendStatusChange(b, next, now);
        return b;
    }

    private static void appendStatusChange(Effects.Builder b, SessionState next, Instant now) {
        b.persist(statusOp(next, now))
         .emit(workStatusChanged(next));
    }

    private static PersistOp.UpdateSessionStatus statusOp(SessionState next, Instant now) {
        return new PersistOp.UpdateSessionStatus(
                next.status(), next.workStatus(), next.currentTurnId(), next.turnCount(), now);
    }

    private static EventPayload.WorkStatusChanged workStatusChanged(SessionState next) {
        return new EventPayload.WorkStatusChanged(next.workStatus(), next.currentTurnId(), next.turnCount());
    }

    private static PersistOp.UpdateTurnState turnState(SessionState next) {
        return new PersistOp.UpdateTurnState(
                next.currentDiff(), next.currentPlan(), next.currentTurnId(), next.turnCount());
    }

    private static Result invalid(SessionState state, SessionInput input) {
        return Result.rejected(state, input.kind() + " not valid in " + phaseName(state.phase()));
    }

    private static String phaseName(WorkPhase phase) {
        return phase.getClass().getSimpleName();
    }

    private static boolean isIdle(SessionState state) {
        return state.phase() instanceof WorkPhase.Idle;
    }

    private static boolean isWorking(SessionState state) {
        return state.phase() instanceof WorkPhase.Working;
    }

    private static boolean isAwaiting(SessionState state) {
        return state.phase() instanceof WorkPhase.AwaitingApproval;
    }
}
