package com.questrail.agentsession.internal.state;

import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageChanges;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.SessionStatus;
import com.questrail.agentsession.api.SessionSummary;
import com.questrail.agentsession.api.TokenUsage;
import com.questrail.agentsession.api.TurnDiff;
import com.questrail.agentsession.api.WorkStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one session's logical state.
 *
 * <h2>Role in the architecture</h2>
 * This is the value consumed and produced by {@link SessionTransition}. It is
 * deliberately:
 * <ul>
 *   <li>Pure data</li>
 *   <li>Immutable (collections are copied on construction)</li>
 *   <li>Safe to hand to any number of concurrent readers</li>
 * </ul>
 *
 * Only the owning session actor ever produces new instances for a live
 * session; everyone else reads the last published snapshot.
 *
 * @param revision       number of events emitted so far
 * @param currentTurnId  identifier of the running turn, if any
 * @param pendingApproval request shown to viewers while awaiting approval
 * @param lastActivityAt time of the last step that emitted an event
 */
public record SessionState(String id,
                           long revision,
                           WorkPhase phase,
                           List<Message> messages,
                           TokenUsage tokenUsage,
                           String currentDiff,
                           String currentPlan,
                           SessionMetadata metadata,
                           String currentTurnId,
                           long turnCount,
                           List<TurnDiff> turnDiffs,
                           ApprovalRequest pendingApproval,
                           Instant lastActivityAt)
{
    public SessionState {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(tokenUsage, "tokenUsage");
        Objects.requireNonNull(metadata, "metadata");
        if (revision < 0) {
            throw new IllegalArgumentException("revision must be >= 0");
        }
        messages = List.copyOf(messages);
        turnDiffs = List.copyOf(turnDiffs);
    }

    /**
     * Creates the state of a brand-new session.
     */
    public static SessionState created(String id, SessionMetadata metadata) {
        return new SessionState(id, 0, WorkPhase.idle(), List.of(), TokenUsage.empty(),
                null, null, metadata, null, 0, List.of(), null, metadata.startedAt());
    }

    public SessionStatus status() {
        return phase instanceof WorkPhase.Ended ? SessionStatus.ENDED : SessionStatus.ACTIVE;
    }

    public WorkStatus workStatus() {
        return phase.toWorkStatus();
    }

    public boolean isEnded() {
        return phase instanceof WorkPhase.Ended;
    }

    public SessionSummary summary() {
        return new SessionSummary(
                id,
                metadata.provider(),
                metadata.projectPath(),
                metadata.model(),
                metadata.customName(),
                status(),
                workStatus(),
                pendingApproval != null,
                tokenUsage,
                messages.size(),
                metadata.startedAt(),
                lastActivityAt,
                revision);
    }

    // ---------------------------------------------------------------------
    // Withers
    // ---------------------------------------------------------------------

    public SessionState withRevision(long newRevision) {
        return new SessionState(id, newRevision, phase, messages, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    /**
     * Replaces the phase. Leaving {@link WorkPhase.AwaitingApproval} always
     * clears the pending approval request.
     */
    public SessionState withPhase(WorkPhase newPhase) {
        ApprovalRequest pending = newPhase instanceof WorkPhase.AwaitingApproval ? pendingApproval : null;
        return new SessionState(id, revision, newPhase, messages, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pending,
                lastActivityAt);
    }

    /**
     * Enters {@link WorkPhase.AwaitingApproval} for the given request.
     */
    public SessionState awaiting(ApprovalRequest request) {
        WorkPhase.AwaitingApproval awaiting = new WorkPhase.AwaitingApproval(
                request.id(), request.type(), request.proposedAmendment());
        return new SessionState(id, revision, awaiting, messages, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, request,
                lastActivityAt);
    }

    public SessionState withMessageAppended(Message message) {
        List<Message> updated = new ArrayList<>(messages.size() + 1);
        updated.addAll(messages);
        updated.add(message);
        return new SessionState(id, revision, phase, updated, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    /**
     * Applies a partial update to the message with the given id. Unknown ids
     * leave the state unchanged.
     */
    public SessionState withMessageUpdated(String messageId, MessageChanges changes) {
        List<Message> updated = null;
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).id().equals(messageId)) {
                updated = new ArrayList<>(messages);
                updated.set(i, messages.get(i).withChanges(changes));
                break;
            }
        }
        if (updated == null) {
            return this;
        }
        return new SessionState(id, revision, phase, updated, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withTokenUsage(TokenUsage usage) {
        return new SessionState(id, revision, phase, messages, usage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withCurrentDiff(String diff) {
        return new SessionState(id, revision, phase, messages, tokenUsage, diff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withCurrentPlan(String plan) {
        return new SessionState(id, revision, phase, messages, tokenUsage, currentDiff,
                plan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withMetadata(SessionMetadata newMetadata) {
        return new SessionState(id, revision, phase, messages, tokenUsage, currentDiff,
                currentPlan, newMetadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withTurn(String turnId, long count) {
        return new SessionState(id, revision, phase, messages, tokenUsage, currentDiff,
                currentPlan, metadata, turnId, count, turnDiffs, pendingApproval,
                lastActivityAt);
    }

    public SessionState withTurnDiffRecorded(TurnDiff turnDiff) {
        List<TurnDiff> updated = new ArrayList<>(turnDiffs.size() + 1);
        updated.addAll(turnDiffs);
        updated.add(turnDiff);
        return new SessionState(id, revision, phase, messages, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, updated, pendingApproval,
                lastActivityAt);
    }

    public SessionState withLastActivityAt(Instant at) {
        return new SessionState(id, revision, phase, messages, tokenUsage, currentDiff,
                currentPlan, metadata, currentTurnId, turnCount, turnDiffs, pendingApproval,
                at);
    }
}
