package com.questrail.agentsession.observability;

/**
 * No-op implementation of SessionObservabilitySink.
 */
public final class NullObservabilitySink implements SessionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SessionTransitionEvent event) {}

    @Override
    public void onInvalidTransition(InvalidTransitionEvent event) {}

    @Override
    public void onSubscriberDropped(SubscriberDroppedEvent event) {}

    @Override
    public void onError(SessionErrorEvent event) {}
}
