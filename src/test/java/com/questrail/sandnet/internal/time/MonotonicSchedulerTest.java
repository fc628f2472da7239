package com.questrail.sandnet.internal.time;

import com.questrail.sandnet.time.DeterministicScheduler;
import com.questrail.sandnet.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MonotonicSchedulerTest
 * -----------------------------------------------------------------------------
 * Exercises the default repeating schedule built on one-shot deadlines.
 */
class MonotonicSchedulerTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);

    @Test
    void repeatingTaskRunsOncePerPeriod() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.scheduleEvery(Duration.ofMillis(100), clock, runs::incrementAndGet);

        scheduler.runDueTasks();
        assertEquals(0, runs.get());

        for (int i = 1; i <= 5; i++) {
            clock.advanceMillis(100);
            scheduler.runDueTasks();
            assertEquals(i, runs.get());
        }
    }

    @Test
    void cancelStopsFurtherRuns() {
        AtomicInteger runs = new AtomicInteger();
        Cancellable handle = scheduler.scheduleEvery(Duration.ofMillis(100), clock, runs::incrementAndGet);

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertTrue(handle.cancel());
        assertFalse(handle.cancel());

        clock.advanceMillis(500);
        scheduler.runDueTasks();
        assertEquals(1, runs.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void taskCancellingItselfIsNotRearmed() {
        AtomicInteger runs = new AtomicInteger();
        Cancellable[] handle = new Cancellable[1];
        handle[0] = scheduler.scheduleEvery(Duration.ofMillis(100), clock, () -> {
            runs.incrementAndGet();
            handle[0].cancel();
        });

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertEquals(1, runs.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void throwingTaskIsNotRearmed() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.scheduleEvery(Duration.ofMillis(100), clock, () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        clock.advanceMillis(100);
        assertThrows(IllegalStateException.class, scheduler::runDueTasks);
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertEquals(1, runs.get());
    }

    @Test
    void nonPositivePeriodIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleEvery(Duration.ZERO, clock, () -> { }));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleEvery(Duration.ofMillis(-1), clock, () -> { }));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), clock, () -> { }));
    }
}
