package com.questrail.agentsession.api;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a session's conversation.
 *
 * @param id         message identifier, unique within the session
 * @param sessionId  owning session; stamped by the session core on append
 * @param type       message kind
 * @param content    text content (never {@code null}, may be empty)
 * @param toolName   tool name for tool messages
 * @param toolInput  serialized tool input for tool messages
 * @param toolOutput tool output, usually filled in later by an update
 * @param error      whether the tool invocation failed
 * @param timestamp  when the message was created
 * @param durationMs tool run time, if known
 */
public record Message(String id,
                      String sessionId,
                      MessageType type,
                      String content,
                      String toolName,
                      String toolInput,
                      String toolOutput,
                      boolean error,
                      Instant timestamp,
                      Long durationMs)
{
    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        content = content == null ? "" : content;
    }

    /**
     * Creates a plain user message.
     */
    public static Message user(String id, String sessionId, String content, Instant timestamp) {
        return new Message(id, sessionId, MessageType.USER, content,
                null, null, null, false, timestamp, null);
    }

    public Message withSessionId(String newSessionId) {
        return new Message(id, newSessionId, type, content, toolName, toolInput,
                toolOutput, error, timestamp, durationMs);
    }

    /**
     * Applies a partial update. Absent fields in {@code changes} are kept.
     */
    public Message withChanges(MessageChanges changes) {
        Objects.requireNonNull(changes, "changes");
        return new Message(
                id,
                sessionId,
                type,
                changes.content() != null ? changes.content() : content,
                toolName,
                toolInput,
                changes.toolOutput() != null ? changes.toolOutput() : toolOutput,
                changes.error() != null ? changes.error() : error,
                timestamp,
                changes.durationMs() != null ? changes.durationMs() : durationMs);
    }
}
