package com.questrail.agentsession.internal.exec;

import com.questrail.agentsession.api.SessionRoutingException;
import com.questrail.agentsession.internal.events.SessionInput;
import com.questrail.agentsession.internal.state.SessionState;

import java.util.concurrent.CompletableFuture;

/**
 * SessionHandle
 * -----------------------------------------------------------------------------
 * Lightweight, thread-safe capability to one running session: its inbox, its
 * subscribe operation and its last published snapshot. This is what the
 * registry stores; the state itself stays inside the actor.
 */
public interface SessionHandle extends EffectFailureListener
{
    String sessionId();

    /**
     * Routes an input into the session's inbox without waiting for it to be
     * processed.
     *
     * @throws SessionRoutingException {@code BUSY} if the inbox is full,
     *         {@code CLOSED} if the session was stopped
     */
    void tell(SessionInput input) throws SessionRoutingException;

    /**
     * Requests a subscription from the given revision. The request is served
     * in order with the session's inputs.
     */
    CompletableFuture<SubscribeResult> subscribe(long sinceRevision);

    /**
     * Last state published by the actor. Never blocks.
     */
    SessionState snapshot();

    /**
     * Asks the actor to stop after the inputs already queued. The future
     * completes with the final state.
     */
    CompletableFuture<SessionState> stop();

    boolean isStopped();
}
