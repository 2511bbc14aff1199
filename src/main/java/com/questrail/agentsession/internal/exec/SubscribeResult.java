package com.questrail.agentsession.internal.exec;

import com.questrail.agentsession.internal.log.LoggedEvent;
import com.questrail.agentsession.internal.log.Subscription;
import com.questrail.agentsession.internal.state.SessionState;

import java.util.List;
import java.util.Objects;

/**
 * Reply to a subscribe request: either the events the subscriber missed, or
 * a full snapshot when they are no longer buffered. In both cases live
 * delivery continues seamlessly on {@link #live()} from the next revision.
 */
public sealed interface SubscribeResult
{
    Subscription<LoggedEvent> live();

    /**
     * @param events events after the requested revision, ascending
     */
    record Replay(List<LoggedEvent> events, Subscription<LoggedEvent> live) implements SubscribeResult {
        public Replay {
            events = List.copyOf(events);
            Objects.requireNonNull(live, "live");
        }
    }

    record Snapshot(SessionState state, Subscription<LoggedEvent> live) implements SubscribeResult {
        public Snapshot {
            Objects.requireNonNull(state, "state");
            Objects.requireNonNull(live, "live");
        }
    }
}
