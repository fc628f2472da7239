package com.questrail.sandnet.internal.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link Sleeper} backed by {@link Thread#sleep(long, int)}.
 */
public enum SystemSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
