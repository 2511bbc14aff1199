package com.questrail.agentsession.persistence;

import com.questrail.agentsession.internal.state.SessionState;

import java.util.List;

/**
 * SessionStore
 * =============================================================================
 * Port to the durable store that records session history.
 *
 * <p>The session core never calls the store from an actor. Writes reach it in
 * batches through {@link BatchingPersistenceWriter}; reads happen once, when
 * the runtime starts and restores sessions.</p>
 */
public interface SessionStore
{
    /**
     * Applies a batch of writes, in order.
     */
    void write(List<PersistenceWrite> batch) throws SessionStoreException;

    /**
     * Returns the last recorded state of every session that did not end.
     */
    List<SessionState> loadActiveSessions() throws SessionStoreException;
}
