package com.questrail.sandnet.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every deadline in the layer: connect deadlines, socket
 * timeouts and cleanup backoff.
 *
 * <p>Wall-clock time ({@code Instant.now()}) must not be used for any of
 * these; it is reserved for observability via {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
