package com.questrail.agentsession.observability;

import java.time.Instant;

/**
 * Record representing an error in a session or in shared infrastructure.
 *
 * @param sessionId affected session, or {@code null} when not session specific
 */
public record SessionErrorEvent(
    Instant timestamp,
    String sessionId,
    String message,
    Throwable cause
) {
}
