package com.questrail.agentsession.internal.effects;

import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageChanges;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.SessionStatus;
import com.questrail.agentsession.api.TokenUsage;
import com.questrail.agentsession.api.TurnDiff;
import com.questrail.agentsession.api.WorkStatus;
import com.questrail.agentsession.internal.state.SessionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Write operations accepted by the durable store. The owning session is
 * attached when the operation is submitted, so operations carry only the
 * data that changed.
 */
public sealed interface PersistOp
{
    record CreateSession(SessionState state) implements PersistOp {
        public CreateSession {
            Objects.requireNonNull(state, "state");
        }
    }

    record AppendMessage(Message message) implements PersistOp {
        public AppendMessage {
            Objects.requireNonNull(message, "message");
        }
    }

    record UpdateMessage(String messageId, MessageChanges changes) implements PersistOp {
        public UpdateMessage {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(changes, "changes");
        }
    }

    record UpdateSessionStatus(SessionStatus status,
                               WorkStatus workStatus,
                               String currentTurnId,
                               long turnCount,
                               Instant lastActivityAt) implements PersistOp {
        public UpdateSessionStatus {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(workStatus, "workStatus");
            Objects.requireNonNull(lastActivityAt, "lastActivityAt");
        }
    }

    record UpdateMetadata(SessionMetadata metadata) implements PersistOp {
        public UpdateMetadata {
            Objects.requireNonNull(metadata, "metadata");
        }
    }

    record UpdateTokenUsage(TokenUsage usage) implements PersistOp {
        public UpdateTokenUsage {
            Objects.requireNonNull(usage, "usage");
        }
    }

    record UpdateTurnState(String currentDiff,
                           String currentPlan,
                           String currentTurnId,
                           long turnCount) implements PersistOp {}

    record RecordApprovalRequest(ApprovalRequest request) implements PersistOp {
        public RecordApprovalRequest {
            Objects.requireNonNull(request, "request");
        }
    }

    /**
     * @param decision wire value of the decision, or {@code "answered"} for
     *                 question answers
     */
    record RecordApprovalDecision(String requestId, String decision) implements PersistOp {
        public RecordApprovalDecision {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(decision, "decision");
        }
    }

    record InsertTurnDiff(TurnDiff turnDiff) implements PersistOp {
        public InsertTurnDiff {
            Objects.requireNonNull(turnDiff, "turnDiff");
        }
    }

    record EndSession(String reason, Instant endedAt) implements PersistOp {
        public EndSession {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(endedAt, "endedAt");
        }
    }

    record ReactivateSession(Instant reactivatedAt) implements PersistOp {
        public ReactivateSession {
            Objects.requireNonNull(reactivatedAt, "reactivatedAt");
        }
    }
}
