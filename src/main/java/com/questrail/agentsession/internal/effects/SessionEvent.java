package com.questrail.agentsession.internal.effects;

import java.time.Instant;
import java.util.Objects;

/**
 * Unit stored in the event log and delivered to subscribers.
 */
public record SessionEvent(long revision,
                           String sessionId,
                           Instant timestamp,
                           EventPayload payload)
{
    public SessionEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
        if (revision < 1) {
            throw new IllegalArgumentException("revision must be >= 1");
        }
    }

    public static SessionEvent of(String sessionId, Effect.Emit emit) {
        return new SessionEvent(emit.revision(), sessionId, emit.timestamp(), emit.payload());
    }
}
