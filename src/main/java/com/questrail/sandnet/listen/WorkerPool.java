package com.questrail.sandnet.listen;

/**
 * WorkerPool
 * -----------------------------------------------------------------------------
 * Thread pool port used to run listener callbacks.
 *
 * <p>A listener given a pool polls without consulting the event budget; the
 * pool's own queueing is the backpressure. The pool is shared, not owned:
 * stopping a listener shuts it down only when asked to.</p>
 */
public interface WorkerPool
{
    /**
     * @throws java.util.concurrent.RejectedExecutionException if the pool cannot take the task
     */
    void submit(Runnable task);

    void shutdown();
}
