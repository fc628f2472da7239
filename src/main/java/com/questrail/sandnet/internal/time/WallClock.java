package com.questrail.sandnet.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used only to timestamp observability events.
 */
public interface WallClock
{
    Instant now();
}
