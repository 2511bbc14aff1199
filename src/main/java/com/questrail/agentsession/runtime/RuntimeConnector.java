package com.questrail.agentsession.runtime;

import com.questrail.agentsession.internal.effects.RuntimeCommand;

import java.util.concurrent.CompletionStage;

/**
 * RuntimeConnector
 * =============================================================================
 * Port to the agent runtime (the process that actually runs the model and its
 * tools).
 *
 * <p>Outbound, the core hands over {@link RuntimeCommand}s. Inbound, the
 * connector reports what the agent does by calling
 * {@link SessionCoreRuntime#onRuntimeEvent}.</p>
 *
 * <p>{@link #send} is called from session actor threads and must not block:
 * implementations start the work and complete the returned stage when it is
 * done. A stage completed exceptionally is fed back to the session as an
 * error.</p>
 */
public interface RuntimeConnector
{
    CompletionStage<Void> send(String sessionId, RuntimeCommand command);
}
