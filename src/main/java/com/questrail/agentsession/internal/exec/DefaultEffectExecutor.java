package com.questrail.agentsession.internal.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.questrail.agentsession.internal.effects.Effect;
import com.questrail.agentsession.internal.effects.SessionEvent;
import com.questrail.agentsession.internal.log.SessionEventChannel;
import com.questrail.agentsession.internal.state.SessionState;
import com.questrail.agentsession.persistence.PersistenceSink;
import com.questrail.agentsession.persistence.PersistenceWrite;
import com.questrail.agentsession.runtime.RuntimeConnector;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Production {@link EffectExecutor} for one session.
 *
 * <ul>
 *   <li>{@code Persist}: handed to the shared persistence channel, never awaited</li>
 *   <li>{@code Emit}: encoded, logged and fanned out through the session's channel</li>
 *   <li>{@code RuntimeCall}: sent to the runtime connector; completion is async</li>
 * </ul>
 */
public final class DefaultEffectExecutor implements EffectExecutor
{
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final PersistenceSink persistence;
    private final RuntimeConnector connector;
    private final SessionEventChannel channel;

    public DefaultEffectExecutor(PersistenceSink persistence,
                                 RuntimeConnector connector,
                                 SessionEventChannel channel)
    {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public CompletionStage<Void> execute(SessionState state, Effect effect) throws EffectExecutionException {
        if (effect instanceof Effect.Persist p) {
            PersistenceWrite write = new PersistenceWrite(state.id(), state.revision(), p.op());
            if (!persistence.submit(write)) {
                throw new EffectExecutionException(
                        "persistence channel rejected " + p.op().getClass().getSimpleName());
            }
            return DONE;
        }
        if (effect instanceof Effect.Emit e) {
            try {
                channel.publish(SessionEvent.of(state.id(), e));
            } catch (JsonProcessingException ex) {
                throw new EffectExecutionException(
                        "could not encode event at revision " + e.revision(), ex);
            }
            return DONE;
        }
        if (effect instanceof Effect.RuntimeCall c) {
            CompletionStage<Void> stage;
            try {
                stage = connector.send(state.id(), c.command());
            } catch (RuntimeException ex) {
                throw new EffectExecutionException(
                        "runtime call " + c.command().getClass().getSimpleName() + " failed", ex);
            }
            return stage != null ? stage : DONE;
        }
        throw new IllegalArgumentException("Unknown effect " + effect);
    }
}
