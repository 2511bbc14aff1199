package com.questrail.agentsession.api;

/**
 * WorkStatus
 * -----------------------------------------------------------------------------
 * What the agent is currently doing, as seen by remote viewers.
 *
 * <p>This is a projection of the internal work phase. Several phases may map
 * to the same status (e.g. both exec and patch approvals map to
 * {@link #PERMISSION}).</p>
 */
public enum WorkStatus {
    /** A turn is in progress. */
    WORKING,

    /** Idle, waiting for the user. */
    WAITING,

    /** Blocked on a tool or patch approval. */
    PERMISSION,

    /** Blocked on an answer to a question. */
    QUESTION,

    /** The session has ended. */
    ENDED
}
