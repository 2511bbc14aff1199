package com.questrail.agentsession.api;

import java.util.Objects;

/**
 * Diff captured at the end of a turn, together with the token usage at that time.
 */
public record TurnDiff(String turnId, String diff, TokenUsage tokenUsage)
{
    public TurnDiff {
        Objects.requireNonNull(turnId, "turnId");
        Objects.requireNonNull(diff, "diff");
        Objects.requireNonNull(tokenUsage, "tokenUsage");
    }
}
