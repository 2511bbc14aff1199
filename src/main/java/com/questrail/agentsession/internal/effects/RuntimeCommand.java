package com.questrail.agentsession.internal.effects;

import com.questrail.agentsession.api.ApprovalDecision;
import com.questrail.agentsession.api.ApprovalType;

import java.util.List;
import java.util.Objects;

/**
 * Commands sent to the agent runtime connector.
 */
public sealed interface RuntimeCommand
{
    record SendMessage(String content, String model, String effort) implements RuntimeCommand {
        public SendMessage {
            Objects.requireNonNull(content, "content");
        }
    }

    record SteerTurn(String content, String messageId) implements RuntimeCommand {
        public SteerTurn {
            Objects.requireNonNull(content, "content");
        }
    }

    record Approve(String requestId,
                   ApprovalType approvalType,
                   ApprovalDecision decision,
                   List<String> proposedAmendment) implements RuntimeCommand {
        public Approve {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(approvalType, "approvalType");
            Objects.requireNonNull(decision, "decision");
            proposedAmendment = proposedAmendment == null ? null : List.copyOf(proposedAmendment);
        }
    }

    record AnswerQuestion(String requestId, String answer) implements RuntimeCommand {
        public AnswerQuestion {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(answer, "answer");
        }
    }

    record Interrupt() implements RuntimeCommand {}

    record SetThreadName(String name) implements RuntimeCommand {}

    record UpdateConfig(String approvalPolicy, String sandboxMode) implements RuntimeCommand {}

    record Compact() implements RuntimeCommand {}

    record Undo() implements RuntimeCommand {}

    record Rollback(int numTurns) implements RuntimeCommand {}

    record Shutdown() implements RuntimeCommand {}
}
