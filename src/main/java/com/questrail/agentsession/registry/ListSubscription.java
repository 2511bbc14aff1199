package com.questrail.agentsession.registry;

import com.questrail.agentsession.api.SessionSummary;
import com.questrail.agentsession.internal.log.Subscription;

import java.util.List;
import java.util.Objects;

/**
 * Reply to a list subscription: the sessions registered at the time of the
 * request, then every later registration and removal.
 *
 * <p>The stream and the summaries are taken together under the registry's
 * membership lock: the first event is the first change after the summaries,
 * and events arrive in the order the changes were made.</p>
 */
public record ListSubscription(List<SessionSummary> sessions, Subscription<SessionListEvent> live)
{
    public ListSubscription {
        sessions = List.copyOf(sessions);
        Objects.requireNonNull(live, "live");
    }
}
