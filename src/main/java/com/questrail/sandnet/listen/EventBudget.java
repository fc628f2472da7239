package com.questrail.sandnet.listen;

/**
 * EventBudget
 * -----------------------------------------------------------------------------
 * Coarse cap on concurrently outstanding callbacks dispatched on dedicated
 * threads.
 *
 * <p>Listeners without a worker pool take one unit before each accept attempt
 * and hand it back when the attempt finds nothing, or when the dispatched
 * callback finishes.</p>
 */
public interface EventBudget
{
    /**
     * Units currently free.
     */
    int available();

    /**
     * Take one unit if any is free.
     */
    boolean tryAcquire();

    /**
     * Return a unit taken by {@link #tryAcquire()}.
     */
    void release();
}
