package com.questrail.sandnet.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled task, one-shot or repeating.
 *
 * <p>Listeners keep one of these for their poll task and cancel it on stop.
 * Cancelling never interrupts an invocation that is already running.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         had already completed or was cancelled earlier.
     */
    boolean cancel();
}
