package com.questrail.sandnet.internal.time;

import java.time.Duration;

/**
 * Sleeper
 * =============================================================================
 * Blocking pause used by polling waits and by connect backoff.
 *
 * <p>Kept separate from {@link MonotonicClock} so tests can substitute a
 * sleeper that advances a manual clock instead of parking the thread.</p>
 */
public interface Sleeper
{
    /**
     * Pause the calling thread for {@code duration}.
     *
     * @throws InterruptedException if the thread is interrupted while paused
     */
    void sleep(Duration duration) throws InterruptedException;
}
