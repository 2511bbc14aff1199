package com.questrail.agentsession.observability;

import com.questrail.agentsession.internal.events.SessionInput;
import com.questrail.agentsession.internal.state.WorkPhase;

import java.time.Instant;

/**
 * Record representing an input that was ignored because it did not apply to
 * the session's phase.
 */
public record InvalidTransitionEvent(
    Instant timestamp,
    String sessionId,
    WorkPhase phase,
    SessionInput input,
    String reason
) {
}
