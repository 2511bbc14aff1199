package com.questrail.agentsession.internal.effects;

import java.time.Instant;
import java.util.Objects;

/**
 * Effect
 * -----------------------------------------------------------------------------
 * A description of work to perform outside the pure transition function.
 *
 * Effects are produced by {@code SessionTransition} and interpreted by an
 * {@code EffectExecutor}. They never perform I/O themselves.
 */
public sealed interface Effect
{
    /** Write to the durable store. */
    record Persist(PersistOp op) implements Effect {
        public Persist {
            Objects.requireNonNull(op, "op");
        }
    }

    /**
     * Publish an event to the session's log and subscribers.
     *
     * @param revision  revision assigned to the event
     * @param timestamp time of the step that produced the event
     */
    record Emit(long revision, Instant timestamp, EventPayload payload) implements Effect {
        public Emit {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /** Send a command to the agent runtime. */
    record RuntimeCall(RuntimeCommand command) implements Effect {
        public RuntimeCall {
            Objects.requireNonNull(command, "command");
        }
    }
}
