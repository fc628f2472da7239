package com.questrail.sandnet.socket;

import com.questrail.sandnet.errors.OperationTimeoutException;
import com.questrail.sandnet.errors.TransportException;
import com.questrail.sandnet.errors.WouldBlockException;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.internal.time.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * PollingWait
 * =============================================================================
 * Emulates a blocking call on top of a non-blocking primitive.
 *
 * <h2>States</h2>
 * <pre>
 *   ATTEMPT --ok-------------------------------------------> SATISFIED
 *   ATTEMPT --would block, timeout == 0--------------------> WouldBlockException
 *   ATTEMPT --would block, elapsed >= timeout--------------> TIMED_OUT
 *   ATTEMPT --would block, otherwise--> SLEEP(poll) -------> ATTEMPT
 * </pre>
 *
 * <p>The elapsed check happens before each sleep, so a bounded wait fails no
 * earlier than its timeout and no later than the timeout plus one poll
 * interval. A {@code null} timeout never times out.</p>
 *
 * <p>Errors other than {@link WouldBlockException} leave the loop untouched.</p>
 */
public final class PollingWait {

    private final MonotonicClock clock;
    private final Sleeper sleeper;

    public PollingWait(MonotonicClock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Run {@code attempt} until it stops reporting would-block.
     *
     * @param attempt      one non-blocking try
     * @param timeout      {@code null} to wait forever, zero to never wait, else the bound
     * @param pollInterval pause between attempts
     * @param operation    name used in the timeout message
     * @throws WouldBlockException        if {@code timeout} is zero and the attempt would block
     * @throws OperationTimeoutException  if the bound elapses
     * @throws TransportException         if interrupted while sleeping
     */
    public <T> T await(Supplier<T> attempt, Duration timeout, Duration pollInterval, String operation) {
        long start = clock.nowNanos();
        while (true) {
            try {
                return attempt.get();
            } catch (WouldBlockException e) {
                if (timeout != null) {
                    if (timeout.isZero()) {
                        throw e;
                    }
                    long elapsed = clock.nowNanos() - start;
                    if (elapsed >= timeout.toNanos()) {
                        throw new OperationTimeoutException(
                                operation + " timed out after " + timeout.toMillis() + "ms", e);
                    }
                }
            }
            pause(pollInterval, operation);
        }
    }

    /**
     * Sleep, translating interruption into a {@link TransportException} with
     * the interrupt flag restored.
     */
    public void pause(Duration duration, String operation) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(operation + " interrupted", e);
        }
    }
}
