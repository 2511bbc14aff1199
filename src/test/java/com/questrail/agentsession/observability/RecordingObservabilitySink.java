package com.questrail.agentsession.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SessionObservabilitySink
{
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(SessionTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onInvalidTransition(InvalidTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSubscriberDropped(SubscriberDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SessionErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SessionTransitionEvent> getStateTransitions() {
        return ofType(SessionTransitionEvent.class);
    }

    public synchronized List<InvalidTransitionEvent> getInvalidTransitions() {
        return ofType(InvalidTransitionEvent.class);
    }

    public synchronized List<SessionErrorEvent> getErrors() {
        return ofType(SessionErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
