package com.questrail.agentsession.internal.time;

/**
 * Cancellation handle for a scheduled task, such as the delayed removal of
 * an ended session from the registry.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
