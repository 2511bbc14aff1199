package com.questrail.agentsession.persistence;

/**
 * Non-blocking entry point of the outbound write channel.
 */
public interface PersistenceSink
{
    /**
     * Hands a write to the channel without waiting for it to be stored.
     *
     * @return {@code false} if the channel is saturated or closed and the
     *         write was not accepted
     */
    boolean submit(PersistenceWrite write);
}
