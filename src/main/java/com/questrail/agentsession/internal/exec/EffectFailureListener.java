package com.questrail.agentsession.internal.exec;

/**
 * Receives effect failures that surface after the effect was started: a
 * runtime call completing exceptionally, or a persistence batch failing on
 * the writer thread.
 *
 * <p>May be called from any thread.</p>
 */
public interface EffectFailureListener
{
    void onEffectFailure(String description, Throwable cause);

    /**
     * A queued persistence write for this session could not be stored.
     */
    void onPersistenceFailure(Throwable cause);
}
