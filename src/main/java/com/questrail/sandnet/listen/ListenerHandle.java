package com.questrail.sandnet.listen;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;

/**
 * Stop function returned by listener registration.
 *
 * <p>Stopping unschedules the poll task, closes the listening handle and
 * releases the tuple in the port registry. Callbacks already dispatched run to
 * completion. Stopping again is a no-op, except that {@code stop(true)} still
 * shuts down a worker pool that an earlier {@code stop(false)} left running.</p>
 */
public interface ListenerHandle {

    /**
     * Same as {@code stop(true)}.
     */
    default void stop() {
        stop(true);
    }

    /**
     * @param destroyPool also shut down the worker pool given at registration, if any
     */
    void stop(boolean destroyPool);

    /**
     * {@code true} once the listener no longer polls, whether stopped by the
     * caller or torn down after an accept failure.
     */
    boolean isStopped();

    Protocol protocol();

    Endpoint tuple();
}
