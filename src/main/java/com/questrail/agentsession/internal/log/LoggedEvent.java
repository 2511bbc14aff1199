package com.questrail.agentsession.internal.log;

import com.questrail.agentsession.internal.effects.SessionEvent;

import java.util.Objects;

/**
 * An emitted event together with its serialized wire form.
 *
 * @param json the event encoded once at publish time; replay and live
 *             delivery hand out the same bytes
 */
public record LoggedEvent(SessionEvent event, String json)
{
    public LoggedEvent {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(json, "json");
    }

    public long revision() {
        return event.revision();
    }
}
