package com.questrail.agentsession.internal.events;

import com.questrail.agentsession.api.ApprovalType;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageChanges;
import com.questrail.agentsession.api.TokenUsage;

import java.util.List;
import java.util.Objects;

/**
 * RuntimeEvent
 * -----------------------------------------------------------------------------
 * Inputs that originate from the agent runtime connector.
 *
 * These describe what the agent is doing (turns, messages, approval requests,
 * token accounting), not what the user asked for.
 */
public sealed interface RuntimeEvent extends SessionInput
{
    /** The agent began a turn. */
    record TurnStarted() implements RuntimeEvent {}

    /** The running turn finished normally. */
    record TurnCompleted() implements RuntimeEvent {}

    /** The running turn was cut short (interrupt, crash, cancellation). */
    record TurnAborted(String reason) implements RuntimeEvent {}

    record MessageCreated(Message message) implements RuntimeEvent {
        public MessageCreated {
            Objects.requireNonNull(message, "message");
        }
    }

    record MessageUpdated(String messageId, MessageChanges changes) implements RuntimeEvent {
        public MessageUpdated {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(changes, "changes");
        }
    }

    /**
     * The agent needs a decision before it can continue. The request id is
     * validated by the transition function, not here, so a malformed request
     * surfaces as an invalid transition rather than an exception.
     */
    record ApprovalRequested(String requestId,
                             ApprovalType approvalType,
                             String command,
                             String filePath,
                             String diff,
                             String question,
                             List<String> proposedAmendment) implements RuntimeEvent
    {
        public ApprovalRequested {
            Objects.requireNonNull(approvalType, "approvalType");
            proposedAmendment = proposedAmendment == null ? null : List.copyOf(proposedAmendment);
        }

        public static ApprovalRequested exec(String requestId, String command) {
            return new ApprovalRequested(requestId, ApprovalType.EXEC, command, null, null, null, null);
        }

        public static ApprovalRequested patch(String requestId, String filePath, String diff) {
            return new ApprovalRequested(requestId, ApprovalType.PATCH, null, filePath, diff, null, null);
        }

        public static ApprovalRequested question(String requestId, String question) {
            return new ApprovalRequested(requestId, ApprovalType.QUESTION, null, null, null, question, null);
        }
    }

    record TokensUpdated(TokenUsage usage) implements RuntimeEvent {
        public TokensUpdated {
            Objects.requireNonNull(usage, "usage");
        }
    }

    record DiffUpdated(String diff) implements RuntimeEvent {}

    record PlanUpdated(String plan) implements RuntimeEvent {}

    record NameUpdated(String name) implements RuntimeEvent {}

    record ModelUpdated(String model) implements RuntimeEvent {}

    record EnvironmentChanged(String cwd, String gitBranch, String gitSha) implements RuntimeEvent {}

    record SessionEnded(String reason) implements RuntimeEvent {
        public SessionEnded {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record ContextCompacted() implements RuntimeEvent {}

    record UndoStarted(String message) implements RuntimeEvent {}

    record UndoCompleted(boolean success, String message) implements RuntimeEvent {}

    record ThreadRolledBack(int numTurns) implements RuntimeEvent {}

    /**
     * Something went wrong. Runtime-reported errors and failed effects share
     * this input so both recover through the same transition.
     */
    record Error(String message, Origin origin) implements RuntimeEvent {
        public enum Origin {
            /** Reported by the agent runtime. */
            RUNTIME,
            /** Raised while executing a runtime call or emit of this session. */
            EFFECT,
            /** Raised by a rejected or failed persistence write. */
            PERSISTENCE
        }

        public Error {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(origin, "origin");
        }

        public static Error fromEffect(String message) {
            return new Error(message, Origin.EFFECT);
        }

        public static Error fromPersistence(String message) {
            return new Error(message, Origin.PERSISTENCE);
        }
    }
}
