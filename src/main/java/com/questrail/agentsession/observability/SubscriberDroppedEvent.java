package com.questrail.agentsession.observability;

import java.time.Instant;

/**
 * Record representing a subscriber detached for lagging.
 *
 * @param bufferSize the buffer the subscriber overflowed
 */
public record SubscriberDroppedEvent(
    Instant timestamp,
    String sessionId,
    int bufferSize
) {
}
