package com.questrail.agentsession.internal.state;

import com.questrail.agentsession.api.ApprovalDecision;
import com.questrail.agentsession.api.ApprovalType;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageChanges;
import com.questrail.agentsession.api.MessageType;
import com.questrail.agentsession.api.Provider;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.SessionStatus;
import com.questrail.agentsession.api.TokenUsage;
import com.questrail.agentsession.api.WorkStatus;
import com.questrail.agentsession.internal.effects.Effect;
import com.questrail.agentsession.internal.effects.EventPayload;
import com.questrail.agentsession.internal.effects.PersistOp;
import com.questrail.agentsession.internal.effects.RuntimeCommand;
import com.questrail.agentsession.internal.events.ClientCommand;
import com.questrail.agentsession.internal.events.RuntimeEvent;
import com.questrail.agentsession.internal.events.SessionInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionTransitionTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure session transition function.
 *
 * These tests deliberately:
 * <ul>
 *   <li>do not involve actors or threads</li>
 *   <li>do not read clocks</li>
 *   <li>do not perform I/O</li>
 * </ul>
 */
class SessionTransitionTest
{

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private SessionTransition transition;
    private Instant now;

    @BeforeEach
    void setUp() {
        transition = new SessionTransition();
        now = T0.plusSeconds(30);
    }

    private static SessionState newSession() {
        return SessionState.created("s-1", SessionMetadata.of(Provider.CLAUDE, "/work/app", T0));
    }

    private SessionState step(SessionState state, SessionInput input) {
        SessionTransition.Result result = transition.apply(state, input, now);
        assertFalse(result.isRejected(), () -> "unexpected rejection: " + result.rejection());
        return result.newState();
    }

    private SessionState working() {
        return step(newSession(), new RuntimeEvent.TurnStarted());
    }

    // ---------------------------------------------------------------------
    // Turn lifecycle
    // ---------------------------------------------------------------------

    @Test
    void userMessageFromIdleStartsWork() {
        SessionTransition.Result result = transition.apply(
                newSession(), new ClientCommand.UserSentMessage("m-1", "fix bug", null, null), now);

        assertFalse(result.isRejected());
        SessionState next = result.newState();
        assertInstanceOf(WorkPhase.Working.class, next.phase());
        assertEquals(1, next.messages().size());
        assertEquals("fix bug", next.messages().get(0).content());
        assertEquals("s-1", next.messages().get(0).sessionId());

        List<Effect> effects = result.effects().list();
        assertEquals(5, effects.size());
        assertInstanceOf(PersistOp.AppendMessage.class, ((Effect.Persist) effects.get(0)).op());
        assertInstanceOf(EventPayload.MessageAppended.class, ((Effect.Emit) effects.get(1)).payload());
        assertInstanceOf(PersistOp.UpdateSessionStatus.class, ((Effect.Persist) effects.get(2)).op());
        assertInstanceOf(EventPayload.WorkStatusChanged.class, ((Effect.Emit) effects.get(3)).payload());
        RuntimeCommand command = ((Effect.RuntimeCall) effects.get(4)).command();
        assertEquals(new RuntimeCommand.SendMessage("fix bug", null, null), command);
    }

    @Test
    void userMessageWithNewModelUpdatesMetadata() {
        SessionTransition.Result result = transition.apply(
                newSession(), new ClientCommand.UserSentMessage("m-1", "hi", "opus", "high"), now);

        assertEquals("opus", result.newState().metadata().model());
        assertEquals(1, result.effects().ofType(Effect.Persist.class).stream()
                .filter(p -> p.op() instanceof PersistOp.UpdateMetadata).count());
        assertEquals(3, result.effects().emitCount());
    }

    @Test
    void userMessageWhileWorkingIsRejected() {
        SessionState state = working();
        SessionTransition.Result result = transition.apply(state, ClientCommand.UserSentMessage.of("again"), now);

        assertTrue(result.isRejected());
        assertSame(state, result.newState());
        assertTrue(result.effects().isEmpty());
    }

    @Test
    void turnStartAssignsSequentialTurnIds() {
        SessionState first = working();
        assertEquals("turn-1", first.currentTurnId());
        assertEquals(1, first.turnCount());

        SessionState idle = step(first, new RuntimeEvent.TurnCompleted());
        assertNull(idle.currentTurnId());
        assertEquals(1, idle.turnCount());

        SessionState second = step(idle, new RuntimeEvent.TurnStarted());
        assertEquals("turn-2", second.currentTurnId());
        assertEquals(2, second.turnCount());
    }

    @Test
    void completedTurnWithDiffRecordsTurnDiff() {
        SessionState state = working();
        state = step(state, new RuntimeEvent.TokensUpdated(new TokenUsage(1200, 300, 100, 200_000)));
        state = step(state, new RuntimeEvent.DiffUpdated("--- a/x\n+++ b/x\n"));

        SessionTransition.Result result = transition.apply(state, new RuntimeEvent.TurnCompleted(), now);

        SessionState idle = result.newState();
        assertInstanceOf(WorkPhase.Idle.class, idle.phase());
        assertEquals(1, idle.turnDiffs().size());
        assertEquals("turn-1", idle.turnDiffs().get(0).turnId());
        assertEquals(1200, idle.turnDiffs().get(0).tokenUsage().inputTokens());
        assertTrue(result.effects().ofType(Effect.Persist.class).stream()
                .anyMatch(p -> p.op() instanceof PersistOp.InsertTurnDiff));
    }

    @Test
    void completedTurnWithoutDiffRecordsNothing() {
        SessionTransition.Result result = transition.apply(working(), new RuntimeEvent.TurnCompleted(), now);

        assertTrue(result.newState().turnDiffs().isEmpty());
        assertEquals(1, result.effects().emitCount());
    }

    @Test
    void turnCompletedWhileIdleIsRejected() {
        SessionTransition.Result result = transition.apply(newSession(), new RuntimeEvent.TurnCompleted(), now);

        assertTrue(result.isRejected());
        assertEquals("TurnCompleted not valid in Idle", result.rejection());
    }

    // ---------------------------------------------------------------------
    // Approvals
    // ---------------------------------------------------------------------

    @Test
    void deniedApprovalReturnsToIdle() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.exec("req-1", "rm -rf build"));

        assertEquals(new WorkPhase.AwaitingApproval("req-1",
                ApprovalType.EXEC, null), awaiting.phase());
        assertEquals(WorkStatus.PERMISSION, awaiting.workStatus());
        assertNotNull(awaiting.pendingApproval());
        assertEquals("rm -rf build", awaiting.pendingApproval().command());

        SessionTransition.Result result = transition.apply(
                awaiting, new ClientCommand.UserApproved("req-1", ApprovalDecision.DENIED), now);

        SessionState idle = result.newState();
        assertInstanceOf(WorkPhase.Idle.class, idle.phase());
        assertNull(idle.pendingApproval());
        assertNull(idle.currentTurnId());

        List<Effect.RuntimeCall> calls = result.effects().ofType(Effect.RuntimeCall.class);
        assertEquals(1, calls.size());
        RuntimeCommand.Approve approve = (RuntimeCommand.Approve) calls.get(0).command();
        assertEquals("req-1", approve.requestId());
        assertEquals(ApprovalDecision.DENIED, approve.decision());
    }

    @Test
    void approvedApprovalResumesWork() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.patch("req-2", "src/A.java", "+x"));

        SessionTransition.Result result = transition.apply(
                awaiting, new ClientCommand.UserApproved("req-2", ApprovalDecision.APPROVED_FOR_SESSION), now);

        assertInstanceOf(WorkPhase.Working.class, result.newState().phase());
        assertEquals("turn-1", result.newState().currentTurnId());
        PersistOp.RecordApprovalDecision decision = result.effects().ofType(Effect.Persist.class).stream()
                .map(Effect.Persist::op)
                .filter(PersistOp.RecordApprovalDecision.class::isInstance)
                .map(PersistOp.RecordApprovalDecision.class::cast)
                .findFirst().orElseThrow();
        assertEquals("approved_for_session", decision.decision());
    }

    @Test
    void approvalForAnotherRequestIsRejected() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.exec("req-1", "make"));

        SessionTransition.Result result = transition.apply(
                awaiting, new ClientCommand.UserApproved("req-9", ApprovalDecision.APPROVED), now);

        assertTrue(result.isRejected());
        assertSame(awaiting, result.newState());
    }

    @Test
    void approvalRequestWithoutIdIsRejected() {
        SessionState state = working();
        SessionTransition.Result result = transition.apply(
                state, RuntimeEvent.ApprovalRequested.exec(" ", "make"), now);

        assertTrue(result.isRejected());
        assertSame(state, result.newState());
    }

    @Test
    void approvalRequestWhileIdleIsRejected() {
        SessionTransition.Result result = transition.apply(
                newSession(), RuntimeEvent.ApprovalRequested.exec("req-1", "make"), now);

        assertTrue(result.isRejected());
    }

    @Test
    void answeredQuestionResumesWork() {
        SessionState asking = step(working(), RuntimeEvent.ApprovalRequested.question("q-1", "Which branch?"));
        assertEquals(WorkStatus.QUESTION, asking.workStatus());

        SessionTransition.Result result = transition.apply(
                asking, new ClientCommand.UserAnsweredQuestion("q-1", "main"), now);

        assertInstanceOf(WorkPhase.Working.class, result.newState().phase());
        assertEquals(List.of(new RuntimeCommand.AnswerQuestion("q-1", "main")),
                result.effects().ofType(Effect.RuntimeCall.class).stream().map(Effect.RuntimeCall::command).toList());
    }

    @Test
    void answeringAnExecApprovalIsRejected() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.exec("req-1", "make"));

        assertTrue(transition.apply(awaiting, new ClientCommand.UserAnsweredQuestion("req-1", "yes"), now)
                .isRejected());
    }

    @Test
    void abortedTurnClearsPendingApproval() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.exec("req-1", "make"));

        SessionState idle = step(awaiting, new RuntimeEvent.TurnAborted("interrupted"));

        assertInstanceOf(WorkPhase.Idle.class, idle.phase());
        assertNull(idle.pendingApproval());
    }

    @Test
    void pendingApprovalPresentExactlyWhileAwaiting() {
        List<SessionInput> inputs = List.of(
                ClientCommand.UserSentMessage.of("build it"),
                new RuntimeEvent.TurnStarted(),
                RuntimeEvent.ApprovalRequested.exec("req-1", "make"),
                new ClientCommand.UserInterrupted(),
                new RuntimeEvent.TurnAborted("interrupted"),
                new ClientCommand.UserSteered("m-2", "try again"),
                RuntimeEvent.ApprovalRequested.question("q-1", "ok?"),
                new ClientCommand.UserAnsweredQuestion("q-1", "yes"),
                RuntimeEvent.ApprovalRequested.patch("req-2", "a.txt", "+a"),
                new ClientCommand.UserEnded(),
                new ClientCommand.Resume());

        SessionState state = newSession();
        for (SessionInput input : inputs) {
            state = transition.apply(state, input, now).newState();
            boolean awaiting = state.phase() instanceof WorkPhase.AwaitingApproval;
            assertEquals(awaiting, state.pendingApproval() != null, "after " + input.kind());
        }
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    @Test
    void runtimeEchoOfRecentUserMessageIsDropped() {
        SessionState state = step(newSession(), new ClientCommand.UserSentMessage("m-1", "hello", null, null));

        SessionTransition.Result result = transition.apply(state,
                new RuntimeEvent.MessageCreated(Message.user("m-echo", null, "hello", now)), now);

        assertFalse(result.isRejected());
        assertSame(state, result.newState());
        assertTrue(result.effects().isEmpty());
    }

    @Test
    void assistantMessagesAreNeverTreatedAsEchoes() {
        SessionState state = step(newSession(), new ClientCommand.UserSentMessage("m-1", "hello", null, null));
        Message reply = new Message("m-2", null, MessageType.ASSISTANT, "hello",
                null, null, null, false, now, null);

        SessionState next = step(state, new RuntimeEvent.MessageCreated(reply));

        assertEquals(2, next.messages().size());
    }

    @Test
    void messageUpdateAppliesPartialChanges() {
        Message tool = new Message("t-1", null, MessageType.TOOL, "", "bash", "ls", null,
                false, now, null);
        SessionState state = step(working(), new RuntimeEvent.MessageCreated(tool));

        SessionState next = step(state, new RuntimeEvent.MessageUpdated("t-1",
                MessageChanges.toolOutput("a.txt", false, 12L)));

        Message updated = next.messages().get(0);
        assertEquals("a.txt", updated.toolOutput());
        assertEquals(12L, updated.durationMs());
        assertEquals("bash", updated.toolName());
    }

    // ---------------------------------------------------------------------
    // Metadata
    // ---------------------------------------------------------------------

    @Test
    void renameIssuesRuntimeCallAndMetadataChange() {
        SessionTransition.Result result = transition.apply(newSession(), new ClientCommand.UserRenamed("Bug hunt"), now);

        assertEquals("Bug hunt", result.newState().metadata().customName());
        assertEquals(1, result.effects().ofType(Effect.RuntimeCall.class).size());
        assertEquals(1, result.effects().emitCount());
    }

    @Test
    void partialConfigChangeKeepsOtherSetting() {
        SessionState state = step(newSession(), new ClientCommand.UserChangedConfig("on-request", "workspace-write"));

        SessionState next = step(state, new ClientCommand.UserChangedConfig("never", null));

        assertEquals("never", next.metadata().approvalPolicy());
        assertEquals("workspace-write", next.metadata().sandboxMode());
    }

    @Test
    void unchangedEnvironmentEmitsNothing() {
        SessionState state = step(newSession(), new RuntimeEvent.EnvironmentChanged("/work/app", "main", "abc123"));

        SessionTransition.Result result = transition.apply(state,
                new RuntimeEvent.EnvironmentChanged(null, "main", null), now);

        assertTrue(result.effects().isEmpty());
        assertSame(state, result.newState());
    }

    // ---------------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------------

    @Test
    void effectErrorWhileWorkingPersistsRecovery() {
        SessionState state = working();

        SessionTransition.Result result = transition.apply(state, RuntimeEvent.Error.fromEffect("runtime gone"), now);

        assertInstanceOf(WorkPhase.Idle.class, result.newState().phase());
        List<Effect.Persist> persists = result.effects().ofType(Effect.Persist.class);
        assertEquals(1, persists.size());
        PersistOp.UpdateSessionStatus status = assertInstanceOf(PersistOp.UpdateSessionStatus.class, persists.get(0).op());
        assertEquals(WorkStatus.WAITING, status.workStatus());
        assertNull(status.currentTurnId());
        List<Effect.Emit> emits = result.effects().ofType(Effect.Emit.class);
        assertEquals(new EventPayload.ErrorReported("runtime gone"), emits.get(0).payload());
        assertInstanceOf(EventPayload.WorkStatusChanged.class, emits.get(1).payload());
    }

    @Test
    void persistenceErrorWhileWorkingRecoversWithoutPersisting() {
        SessionState state = working();

        SessionTransition.Result result = transition.apply(state,
                RuntimeEvent.Error.fromPersistence("disk full"), now);

        assertInstanceOf(WorkPhase.Idle.class, result.newState().phase());
        assertTrue(result.effects().ofType(Effect.Persist.class).isEmpty());
        assertEquals(2, result.effects().ofType(Effect.Emit.class).size());
    }

    @Test
    void runtimeErrorWhileAwaitingPersistsRecovery() {
        SessionState awaiting = step(working(), RuntimeEvent.ApprovalRequested.exec("req-1", "make"));

        SessionTransition.Result result = transition.apply(awaiting,
                new RuntimeEvent.Error("model overloaded", RuntimeEvent.Error.Origin.RUNTIME), now);

        assertInstanceOf(WorkPhase.Idle.class, result.newState().phase());
        assertNull(result.newState().pendingApproval());
        assertEquals(1, result.effects().ofType(Effect.Persist.class).size());
    }

    @Test
    void errorWhileIdleReportsAndPersistsStatus() {
        SessionState idle = newSession();

        SessionTransition.Result result = transition.apply(idle, RuntimeEvent.Error.fromEffect("oops"), now);

        assertInstanceOf(WorkPhase.Idle.class, result.newState().phase());
        assertEquals(1, result.effects().ofType(Effect.Emit.class).size());
        assertEquals(1, result.effects().ofType(Effect.Persist.class).size());
        assertEquals(1, result.newState().revision());
    }

    @Test
    void persistenceErrorWhileIdleOnlyReports() {
        SessionTransition.Result result = transition.apply(newSession(),
                RuntimeEvent.Error.fromPersistence("disk full"), now);

        assertEquals(1, result.effects().size());
        assertEquals(1, result.newState().revision());
    }

    @Test
    void errorAfterEndIsRejected() {
        SessionState ended = step(newSession(), new ClientCommand.UserEnded());

        assertTrue(transition.apply(ended, RuntimeEvent.Error.fromEffect("late"), now).isRejected());
    }

    // ---------------------------------------------------------------------
    // Undo, rollback, compaction
    // ---------------------------------------------------------------------

    @Test
    void undoRoundTripReturnsToIdle() {
        SessionTransition.Result undo = transition.apply(newSession(), new ClientCommand.UserUndo(), now);
        assertInstanceOf(WorkPhase.Working.class, undo.newState().phase());
        assertEquals(new RuntimeCommand.Undo(), undo.effects().ofType(Effect.RuntimeCall.class).get(0).command());

        SessionState started = step(undo.newState(), new RuntimeEvent.UndoStarted("reverting"));
        SessionState done = step(started, new RuntimeEvent.UndoCompleted(true, "reverted"));

        assertInstanceOf(WorkPhase.Idle.class, done.phase());
    }

    @Test
    void rollbackOfZeroTurnsIsRejected() {
        assertTrue(transition.apply(newSession(), new ClientCommand.UserRolledBack(0), now).isRejected());
        assertFalse(transition.apply(newSession(), new ClientCommand.UserRolledBack(2), now).isRejected());
    }

    @Test
    void contextCompactedKeepsPhaseAndPersistsStatus() {
        SessionState state = working();
        SessionTransition.Result result = transition.apply(state, new RuntimeEvent.ContextCompacted(), now);

        assertEquals(state.phase(), result.newState().phase());
        assertEquals(1, result.effects().ofType(Effect.Emit.class).size());
        assertEquals(1, result.effects().ofType(Effect.Persist.class).size());
        assertEquals(state.revision() + 1, result.newState().revision());
    }

    // ---------------------------------------------------------------------
    // End and resume
    // ---------------------------------------------------------------------

    @Test
    void userEndShutsDownRuntimeAndBlocksLaterEnd() {
        SessionTransition.Result result = transition.apply(working(), new ClientCommand.UserEnded(), now);

        SessionState ended = result.newState();
        assertEquals(new WorkPhase.Ended(SessionTransition.USER_REQUESTED), ended.phase());
        assertEquals(SessionStatus.ENDED, ended.status());
        assertEquals(WorkStatus.ENDED, ended.workStatus());
        assertEquals(new RuntimeCommand.Shutdown(),
                result.effects().ofType(Effect.RuntimeCall.class).get(0).command());

        assertTrue(transition.apply(ended, new RuntimeEvent.SessionEnded("exited"), now).isRejected());
        assertTrue(transition.apply(ended, ClientCommand.UserSentMessage.of("hi"), now).isRejected());
    }

    @Test
    void resumeReactivatesEndedSession() {
        SessionState ended = step(newSession(), new RuntimeEvent.SessionEnded("exited"));

        SessionTransition.Result result = transition.apply(ended, new ClientCommand.Resume(), now);

        assertInstanceOf(WorkPhase.Idle.class, result.newState().phase());
        assertEquals(new EventPayload.SessionResumed(),
                result.effects().ofType(Effect.Emit.class).get(0).payload());
        assertTrue(transition.apply(newSession(), new ClientCommand.Resume(), now).isRejected());
    }

    // ---------------------------------------------------------------------
    // Properties
    // ---------------------------------------------------------------------

    @Test
    void sameInputsProduceEqualResults() {
        SessionState state = working();
        SessionInput input = RuntimeEvent.ApprovalRequested.exec("req-1", "make");

        assertEquals(transition.apply(state, input, now), transition.apply(state, input, now));
    }

    @Test
    void revisionAdvancesByEmittedEventCount() {
        List<SessionInput> inputs = List.of(
                new ClientCommand.UserSentMessage("m-1", "go", "sonnet", null),
                new RuntimeEvent.TurnStarted(),
                new RuntimeEvent.DiffUpdated("+1"),
                RuntimeEvent.ApprovalRequested.exec("req-1", "make"),
                new ClientCommand.UserApproved("req-1", ApprovalDecision.APPROVED),
                new RuntimeEvent.TurnCompleted(),
                new ClientCommand.UserInterrupted(),
                new RuntimeEvent.SessionEnded("exited"));

        SessionState state = newSession();
        for (SessionInput input : inputs) {
            SessionTransition.Result result = transition.apply(state, input, now);
            assertEquals(state.revision() + result.effects().emitCount(), result.newState().revision(),
                    input.kind());

            long expected = state.revision() + 1;
            for (Effect.Emit emit : result.effects().ofType(Effect.Emit.class)) {
                assertEquals(expected++, emit.revision());
                assertEquals(now, emit.timestamp());
            }
            state = result.newState();
        }
        assertTrue(state.isEnded());
    }

    @Test
    void stepsWithoutEmissionsKeepActivityTimestamp() {
        SessionState state = working();
        Instant later = now.plusSeconds(60);

        SessionTransition.Result result = transition.apply(state, new ClientCommand.UserInterrupted(), later);

        assertEquals(state.revision(), result.newState().revision());
        assertEquals(state.lastActivityAt(), result.newState().lastActivityAt());
        assertEquals(1, result.effects().size());
    }
}
