package com.questrail.agentsession.observability;

import com.questrail.agentsession.internal.state.WorkPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SessionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSessionObservabilitySink implements SessionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSessionObservabilitySink.class);

    @Override
    public void onStateTransition(SessionTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Session {}: phase {} -> {} (rev {})",
                event.sessionId(),
                describe(event.oldState().phase()),
                describe(event.newState().phase()),
                event.newState().revision());
        } else if (log.isDebugEnabled()) {
            log.debug("Session {}: applied {} (rev {}, {} effects)",
                event.sessionId(),
                event.input().kind(),
                event.newState().revision(),
                event.effects().size());
        }
    }

    @Override
    public void onInvalidTransition(InvalidTransitionEvent event) {
        log.warn("Session {}: ignored {} in phase {}: {}",
            event.sessionId(),
            event.input().kind(),
            describe(event.phase()),
            event.reason());
    }

    @Override
    public void onSubscriberDropped(SubscriberDroppedEvent event) {
        log.info("Session {}: dropped lagging subscriber (buffer {})",
            event.sessionId(), event.bufferSize());
    }

    @Override
    public void onError(SessionErrorEvent event) {
        if (event.sessionId() != null) {
            log.error("Session {}: {}", event.sessionId(), event.message(), event.cause());
        } else {
            log.error("Session core error: {}", event.message(), event.cause());
        }
    }

    private static String describe(WorkPhase phase) {
        if (phase instanceof WorkPhase.AwaitingApproval a) {
            return "AwaitingApproval[" + a.requestId() + "]";
        }
        if (phase instanceof WorkPhase.Ended e) {
            return "Ended[" + e.reason() + "]";
        }
        return phase.toString();
    }
}
