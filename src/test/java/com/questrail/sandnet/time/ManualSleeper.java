package com.questrail.sandnet.time;

import com.questrail.sandnet.internal.time.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that advances a {@link ManualMonotonicClock} instead of parking the
 * thread, and records every pause.
 *
 * <p>An optional hook runs after each pause so tests can make data or
 * capacity appear "while" a caller is waiting.</p>
 */
public final class ManualSleeper implements Sleeper {

    private final ManualMonotonicClock clock;
    private final List<Duration> sleeps = new ArrayList<>();
    private Runnable afterSleep = () -> { };

    public ManualSleeper(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("interrupted before sleep");
        }
        sleeps.add(duration);
        clock.advance(duration);
        afterSleep.run();
    }

    public synchronized void afterEachSleep(Runnable hook) {
        this.afterSleep = hook;
    }

    public synchronized List<Duration> sleeps() {
        return new ArrayList<>(sleeps);
    }

    public synchronized int sleepCount() {
        return sleeps.size();
    }
}
