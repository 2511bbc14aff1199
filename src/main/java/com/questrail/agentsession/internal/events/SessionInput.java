package com.questrail.agentsession.internal.events;

/**
 * SessionInput
 * -----------------------------------------------------------------------------
 * Closed set of every stimulus a session can receive.
 *
 * <h2>Role in the architecture</h2>
 * Sessions are modeled as actors. All changes to a session's state occur
 * strictly in response to {@link SessionInput}s that are serialized through
 * the session's inbox and processed one at a time. Inputs come from two
 * sources:
 * <ul>
 *   <li>{@link RuntimeEvent}: produced by the agent runtime connector</li>
 *   <li>{@link ClientCommand}: issued by remote viewers</li>
 * </ul>
 *
 * Inputs carry no timestamp. The time of processing is supplied separately
 * to the transition function, so replaying the same inputs with the same
 * timestamps yields the same result.
 */
public sealed interface SessionInput permits RuntimeEvent, ClientCommand
{
    /**
     * Short name used for logging and rejection reasons.
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
