package com.questrail.agentsession.persistence;

import com.questrail.agentsession.internal.effects.PersistOp;

import java.util.Objects;

/**
 * A {@link PersistOp} addressed to its session.
 *
 * @param revision session revision after the step that produced the write
 */
public record PersistenceWrite(String sessionId, long revision, PersistOp op)
{
    public PersistenceWrite {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(op, "op");
    }
}
