package com.questrail.agentsession.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Raised synchronously when a command, event or subscription cannot be routed
 * to a session.
 *
 * <p>Callers are expected to react immediately (report to the viewer, retry
 * later against the currently visible revision); routing never waits.</p>
 */
public final class SessionRoutingException extends Exception
{
    /**
     * Why routing failed.
     */
    public enum Reason {
        /** No live session with this id. */
        NOT_FOUND,

        /** The session's inbox is saturated. */
        BUSY,

        /** The session has ended and the input cannot revive it. */
        ENDED,

        /** The session's actor has been stopped. */
        CLOSED
    }

    private final String sessionId;
    private final Reason reason;

    public SessionRoutingException(String sessionId, Reason reason) {
        super("Session " + sessionId + ": " + reason.name().toLowerCase(Locale.ROOT));
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String sessionId() {
        return sessionId;
    }

    public Reason reason() {
        return reason;
    }
}
