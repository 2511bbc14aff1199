package com.questrail.agentsession.internal.effects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageChanges;
import com.questrail.agentsession.api.SessionMetadata;
import com.questrail.agentsession.api.TokenUsage;
import com.questrail.agentsession.api.TurnDiff;
import com.questrail.agentsession.api.WorkStatus;

import java.util.Objects;

/**
 * EventPayload
 * -----------------------------------------------------------------------------
 * Body of a {@link SessionEvent}, as seen by subscribers.
 *
 * The set of payloads is closed and serialized with a {@code type}
 * discriminator. Each payload carries enough data for a subscriber to apply
 * it to its copy of the session state without consulting anything else.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventPayload.WorkStatusChanged.class, name = "work_status_changed"),
        @JsonSubTypes.Type(value = EventPayload.MessageAppended.class, name = "message_appended"),
        @JsonSubTypes.Type(value = EventPayload.MessageUpdated.class, name = "message_updated"),
        @JsonSubTypes.Type(value = EventPayload.ApprovalRequested.class, name = "approval_requested"),
        @JsonSubTypes.Type(value = EventPayload.TokensUpdated.class, name = "tokens_updated"),
        @JsonSubTypes.Type(value = EventPayload.DiffUpdated.class, name = "diff_updated"),
        @JsonSubTypes.Type(value = EventPayload.PlanUpdated.class, name = "plan_updated"),
        @JsonSubTypes.Type(value = EventPayload.MetadataChanged.class, name = "metadata_changed"),
        @JsonSubTypes.Type(value = EventPayload.TurnDiffRecorded.class, name = "turn_diff_recorded"),
        @JsonSubTypes.Type(value = EventPayload.SessionEnded.class, name = "session_ended"),
        @JsonSubTypes.Type(value = EventPayload.SessionResumed.class, name = "session_resumed"),
        @JsonSubTypes.Type(value = EventPayload.ContextCompacted.class, name = "context_compacted"),
        @JsonSubTypes.Type(value = EventPayload.UndoStarted.class, name = "undo_started"),
        @JsonSubTypes.Type(value = EventPayload.UndoCompleted.class, name = "undo_completed"),
        @JsonSubTypes.Type(value = EventPayload.ThreadRolledBack.class, name = "thread_rolled_back"),
        @JsonSubTypes.Type(value = EventPayload.ErrorReported.class, name = "error_reported")
})
public sealed interface EventPayload
{
    /**
     * @param currentTurnId turn id after the change, if a turn is running
     * @param turnCount     number of turns started so far
     */
    record WorkStatusChanged(WorkStatus workStatus, String currentTurnId, long turnCount)
            implements EventPayload {
        public WorkStatusChanged {
            Objects.requireNonNull(workStatus, "workStatus");
        }
    }

    record MessageAppended(Message message) implements EventPayload {}

    record MessageUpdated(String messageId, MessageChanges changes) implements EventPayload {}

    record ApprovalRequested(ApprovalRequest request) implements EventPayload {}

    record TokensUpdated(TokenUsage usage) implements EventPayload {}

    record DiffUpdated(String diff) implements EventPayload {}

    record PlanUpdated(String plan) implements EventPayload {}

    /** Carries the full metadata after the change. */
    record MetadataChanged(SessionMetadata metadata) implements EventPayload {}

    record TurnDiffRecorded(TurnDiff turnDiff) implements EventPayload {}

    record SessionEnded(String reason) implements EventPayload {}

    record SessionResumed() implements EventPayload {}

    record ContextCompacted() implements EventPayload {}

    record UndoStarted(String message) implements EventPayload {}

    record UndoCompleted(boolean success, String message) implements EventPayload {}

    record ThreadRolledBack(int numTurns) implements EventPayload {}

    record ErrorReported(String message) implements EventPayload {}
}
