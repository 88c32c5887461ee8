package com.questrail.relaybridge.protocol.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled relay timer (connect window, request
 * deadline, keepalive ping or keepalive deadline).
 *
 * <p>Implemented by the production {@link ScheduledExecutorScheduler} and by the
 * deterministic scheduler used in tests.</p>
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
