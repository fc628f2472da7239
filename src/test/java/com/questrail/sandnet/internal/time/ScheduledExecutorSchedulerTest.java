package com.questrail.sandnet.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler implementation.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Task should execute");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(100);
        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(200);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void repeatingTaskRunsUntilCancelled() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);

        Cancellable handle = scheduler.scheduleEvery(Duration.ofMillis(10), SystemMonotonicClock.INSTANCE, () -> {
            runs.incrementAndGet();
            threeRuns.countDown();
        });

        assertTrue(threeRuns.await(2, TimeUnit.SECONDS));
        assertTrue(handle.cancel());

        // let a run that was already in progress finish
        Thread.sleep(50);
        int afterCancel = runs.get();
        Thread.sleep(100);
        assertEquals(afterCancel, runs.get());
    }

    @Test
    void repeatingRunsNeverOverlap() throws InterruptedException {
        AtomicInteger active = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        CountDownLatch runs = new CountDownLatch(5);

        Cancellable handle = scheduler.scheduleEvery(Duration.ofMillis(1), SystemMonotonicClock.INSTANCE, () -> {
            if (active.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            runs.countDown();
        });

        assertTrue(runs.await(2, TimeUnit.SECONDS));
        handle.cancel();
        assertFalse(overlapped.get());
    }
}
