package com.questrail.sandnet.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MonotonicScheduler
 * =============================================================================
 * Run-loop surface the listener manager schedules its poll tasks on.
 *
 * <h2>Binding invariant</h2>
 * Scheduling is expressed in monotonic ticks or durations, never in wall-clock
 * instants.
 *
 * <h2>Repeating tasks</h2>
 * {@link #scheduleEvery} has a default implementation that re-arms a one-shot
 * task after each run, so a scheduler only has to provide
 * {@link #scheduleAtNanos}. Invocations of one repeating task never overlap.
 * If the task throws, it is not re-armed.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a delay measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Run {@code task} every {@code period}, first run one period from now.
     * The period is measured from the end of one run to the start of the next.
     *
     * @param period strictly positive interval
     * @return handle that stops further runs
     */
    default Cancellable scheduleEvery(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        RepeatingTask repeating = new RepeatingTask(this, period, clock, task);
        repeating.arm();
        return repeating;
    }

    /**
     * Self re-arming wrapper behind the default {@link #scheduleEvery}.
     */
    final class RepeatingTask implements Cancellable, Runnable
    {
        private final MonotonicScheduler scheduler;
        private final Duration period;
        private final MonotonicClock clock;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private volatile Cancellable pending;

        private RepeatingTask(MonotonicScheduler scheduler, Duration period, MonotonicClock clock, Runnable task)
        {
            this.scheduler = scheduler;
            this.period = period;
            this.clock = clock;
            this.task = task;
        }

        private void arm()
        {
            pending = scheduler.scheduleAfter(period, clock, this);
            // cancel() may have raced with re-arming
            if (cancelled.get()) {
                pending.cancel();
            }
        }

        @Override
        public void run()
        {
            if (cancelled.get()) {
                return;
            }
            task.run();
            if (!cancelled.get()) {
                arm();
            }
        }

        @Override
        public boolean cancel()
        {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
            }
            return true;
        }
    }
}
