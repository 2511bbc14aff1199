package com.questrail.agentsession.internal.events;

import com.questrail.agentsession.api.ApprovalDecision;

import java.util.Objects;
import java.util.UUID;

/**
 * ClientCommand
 * -----------------------------------------------------------------------------
 * Inputs issued by remote viewers and routed through the session registry.
 */
public sealed interface ClientCommand extends SessionInput
{
    /**
     * Starts a new turn with a user message.
     *
     * @param messageId id assigned to the synthesized user message
     * @param model     optional model override for this turn
     * @param effort    optional reasoning effort hint
     */
    record UserSentMessage(String messageId, String content, String model, String effort)
            implements ClientCommand
    {
        public UserSentMessage {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(content, "content");
        }

        public static UserSentMessage of(String content) {
            return new UserSentMessage(UUID.randomUUID().toString(), content, null, null);
        }
    }

    /** Injects guidance into the running turn. */
    record UserSteered(String messageId, String content) implements ClientCommand {
        public UserSteered {
            Objects.requireNonNull(messageId, "messageId");
            Objects.requireNonNull(content, "content");
        }

        public static UserSteered of(String content) {
            return new UserSteered(UUID.randomUUID().toString(), content);
        }
    }

    record UserApproved(String requestId, ApprovalDecision decision) implements ClientCommand {
        public UserApproved {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(decision, "decision");
        }
    }

    record UserAnsweredQuestion(String requestId, String answer) implements ClientCommand {
        public UserAnsweredQuestion {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(answer, "answer");
        }
    }

    record UserRenamed(String name) implements ClientCommand {}

    record UserChangedConfig(String approvalPolicy, String sandboxMode) implements ClientCommand {}

    record UserInterrupted() implements ClientCommand {}

    record UserCompacted() implements ClientCommand {}

    record UserUndo() implements ClientCommand {}

    record UserRolledBack(int numTurns) implements ClientCommand {}

    record UserEnded() implements ClientCommand {}

    /** Reactivates an ended session. */
    record Resume() implements ClientCommand {}
}
