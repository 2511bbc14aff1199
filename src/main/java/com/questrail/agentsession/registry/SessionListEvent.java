package com.questrail.agentsession.registry;

import com.questrail.agentsession.api.SessionSummary;

import java.util.Objects;

/**
 * Change to the set of live sessions, delivered to list subscribers.
 */
public sealed interface SessionListEvent
{
    String sessionId();

    record Registered(SessionSummary summary) implements SessionListEvent {
        public Registered {
            Objects.requireNonNull(summary, "summary");
        }

        @Override
        public String sessionId() {
            return summary.id();
        }
    }

    record Removed(String sessionId) implements SessionListEvent {
        public Removed {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }
}
