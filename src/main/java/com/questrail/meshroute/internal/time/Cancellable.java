package com.questrail.meshroute.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled task (queue tick, probe deadline, session expiry).
 *
 * <p>Implemented by the executor-backed scheduler, the Netty timer wheel and
 * the deterministic test scheduler.</p>
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
