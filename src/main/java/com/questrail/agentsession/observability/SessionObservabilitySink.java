package com.questrail.agentsession.observability;

/**
 * Receives session core observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked from session actor threads and must not block.</p>
 */
public interface SessionObservabilitySink {
    /**
     * Called after a session applied an input.
     */
    void onStateTransition(SessionTransitionEvent event);

    /**
     * Called when an input did not apply to the session's current phase.
     */
    void onInvalidTransition(InvalidTransitionEvent event);

    /**
     * Called when a subscriber was dropped for falling behind.
     */
    void onSubscriberDropped(SubscriberDroppedEvent event);

    /**
     * Called when an effect or background write failed.
     */
    void onError(SessionErrorEvent event);
}
