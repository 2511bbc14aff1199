package com.questrail.agentsession.observability;

import com.questrail.agentsession.internal.effects.Effects;
import com.questrail.agentsession.internal.events.SessionInput;
import com.questrail.agentsession.internal.state.SessionState;

import java.time.Instant;

/**
 * Record representing one applied input.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    SessionState oldState,
    SessionState newState,
    SessionInput input,
    Effects effects
) {
    public String sessionId() {
        return newState.id();
    }

    /**
     * Checks if the work phase kind changed (for example Working to Idle).
     */
    public boolean isPhaseChange() {
        return oldState.phase().getClass() != newState.phase().getClass();
    }

    public boolean endedSession() {
        return !oldState.isEnded() && newState.isEnded();
    }

    public boolean resumedSession() {
        return oldState.isEnded() && !newState.isEnded();
    }
}
