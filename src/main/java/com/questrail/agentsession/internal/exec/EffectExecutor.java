package com.questrail.agentsession.internal.exec;

import com.questrail.agentsession.internal.effects.Effect;
import com.questrail.agentsession.internal.state.SessionState;

import java.util.concurrent.CompletionStage;

/**
 * EffectExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure session state machine and the impure
 * world of persistence, event delivery and runtime calls.
 *
 * <h2>Role in the architecture</h2>
 * The executor realizes the {@link Effect}s produced by
 * {@link com.questrail.agentsession.internal.state.SessionTransition}. It is
 * the ONLY layer allowed to:
 * <ul>
 *   <li>Submit writes to the persistence channel</li>
 *   <li>Append to the event log and deliver to subscribers</li>
 *   <li>Call the agent runtime</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * Called only from the owning session actor, one effect at a time, in the
 * order the transition produced them. Execution must be <b>non-blocking</b>:
 * work that completes later (a runtime call) is represented by the returned
 * stage, and its failure is reported back to the session as an input.
 */
public interface EffectExecutor
{
    /**
     * Execute one effect.
     *
     * @param state  the session state after the step that produced the effect
     * @param effect the effect to carry out
     * @return a stage that completes when the effect's I/O has finished; an
     *         already completed stage for synchronous effects
     * @throws EffectExecutionException if the effect could not be started
     */
    CompletionStage<Void> execute(SessionState state, Effect effect) throws EffectExecutionException;
}
