package com.questrail.agentsession.api;

/**
 * Partial update of a {@link Message}. {@code null} components mean "unchanged".
 */
public record MessageChanges(String content,
                             String toolOutput,
                             Boolean error,
                             Long durationMs)
{
    public static MessageChanges toolOutput(String output, boolean error, Long durationMs) {
        return new MessageChanges(null, output, error, durationMs);
    }

    public static MessageChanges content(String content) {
        return new MessageChanges(content, null, null, null);
    }
}
