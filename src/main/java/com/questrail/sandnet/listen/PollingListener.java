package com.questrail.sandnet.listen;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.errors.WouldBlockException;
import com.questrail.sandnet.internal.time.Cancellable;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.internal.time.MonotonicScheduler;
import com.questrail.sandnet.internal.time.WallClock;
import com.questrail.sandnet.observability.ListenerErrorDelegate;
import com.questrail.sandnet.observability.ListenerErrorEvent;
import com.questrail.sandnet.ports.PortRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PollingListener
 * =============================================================================
 * Shared accept-poll lifecycle for TCP and UDP listeners.
 *
 * <h2>Poll task</h2>
 * Runs on the scheduler and never blocks. Only an {@link Error} escapes it. Each invocation drains
 * everything pending:
 * <pre>
 *   while (pool present || budget.tryAcquire())
 *       take()  -- ok          --> dispatch to pool / new thread
 *               -- would block --> give the unit back, return
 *               -- other error --> tear down, report, return
 *               -- Error       --> tear down, rethrow
 * </pre>
 *
 * <h2>Containment</h2>
 * Anything a callback throws is caught on the callback thread, the item is
 * discarded (TCP closes the socket) and the failure is reported to the error
 * delegate. Failures of the delegate itself are logged and dropped.
 *
 * @param <T> what one successful {@link #take()} yields
 */
abstract class PollingListener<T> implements ListenerHandle {
    private static final Logger log = LoggerFactory.getLogger(PollingListener.class);

    private final Protocol protocol;
    private final Endpoint tuple;
    private final PortRegistry registry;
    private final WorkerPool pool;
    private final EventBudget budget;
    private final ThreadFactory threadFactory;
    private final ListenerErrorDelegate errorDelegate;
    private final WallClock wallClock;

    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicBoolean poolDestroyed = new AtomicBoolean(false);
    private volatile Cancellable scheduledPoll;

    PollingListener(Protocol protocol,
                    Endpoint tuple,
                    PortRegistry registry,
                    WorkerPool pool,
                    EventBudget budget,
                    ThreadFactory threadFactory,
                    ListenerErrorDelegate errorDelegate,
                    WallClock wallClock) {
        this.protocol = protocol;
        this.tuple = tuple;
        this.registry = registry;
        this.pool = pool;
        this.budget = budget;
        this.threadFactory = threadFactory;
        this.errorDelegate = errorDelegate;
        this.wallClock = wallClock;
    }

    /**
     * One non-blocking accept or receive.
     *
     * @throws WouldBlockException if nothing is pending
     */
    protected abstract T take();

    /**
     * Hand {@code item} to the user callback.
     */
    protected abstract void deliver(T item) throws Exception;

    /**
     * Release whatever {@code item} holds after its callback failed or could
     * not be dispatched.
     */
    protected void discard(T item) {
    }

    /**
     * Close the raw listening handle.
     */
    protected abstract void closeRaw();

    /**
     * Begin polling. If the scheduler refuses the task the listener is
     * released before the failure propagates.
     */
    final void start(MonotonicScheduler scheduler, MonotonicClock clock, Duration pollInterval) {
        try {
            scheduledPoll = scheduler.scheduleEvery(pollInterval, clock, this::poll);
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        if (released.get()) {
            scheduledPoll.cancel();
        }
    }

    final void poll() {
        while (!released.get()) {
            boolean budgeted = pool == null;
            if (budgeted && !budget.tryAcquire()) {
                return;
            }

            T item;
            try {
                item = take();
            } catch (WouldBlockException e) {
                giveBack(budgeted);
                return;
            } catch (RuntimeException e) {
                giveBack(budgeted);
                if (release()) {
                    log.warn("{} listener on {} torn down after accept failure: {}", protocol.tag(), tuple, e.toString());
                    report("accept failed", e);
                }
                return;
            } catch (Error e) {
                giveBack(budgeted);
                if (release()) {
                    log.warn("{} listener on {} torn down after fatal accept error", protocol.tag(), tuple, e);
                }
                throw e;
            }

            dispatch(item, budgeted);
        }
    }

    @Override
    public void stop(boolean destroyPool) {
        if (release()) {
            log.debug("{} listener on {} stopped", protocol.tag(), tuple);
        }
        if (destroyPool && pool != null && poolDestroyed.compareAndSet(false, true)) {
            pool.shutdown();
        }
    }

    @Override
    public boolean isStopped() {
        return released.get();
    }

    @Override
    public Protocol protocol() {
        return protocol;
    }

    @Override
    public Endpoint tuple() {
        return tuple;
    }

    @Override
    public String toString() {
        return protocol.tag() + " listener on " + tuple + (released.get() ? " (stopped)" : "");
    }

    private void dispatch(T item, boolean budgeted) {
        if (pool != null) {
            try {
                pool.submit(() -> runCallback(item));
            } catch (RuntimeException e) {
                discard(item);
                report("dispatch rejected", e);
            }
            return;
        }

        try {
            Thread thread = threadFactory.newThread(() -> {
                try {
                    runCallback(item);
                } finally {
                    budget.release();
                }
            });
            if (thread == null) {
                throw new IllegalStateException("thread factory refused to create a callback thread");
            }
            thread.start();
        } catch (RuntimeException e) {
            giveBack(budgeted);
            discard(item);
            report("dispatch failed", e);
        }
    }

    private void runCallback(T item) {
        try {
            deliver(item);
        } catch (Exception e) {
            discard(item);
            report("callback failed", e);
        }
    }

    private boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        Cancellable poll = scheduledPoll;
        if (poll != null) {
            poll.cancel();
        }
        try {
            closeRaw();
        } catch (RuntimeException e) {
            log.warn("Failed to close {} listener on {}", protocol.tag(), tuple, e);
        }
        if (!registry.deregister(protocol, tuple)) {
            log.debug("{} tuple {} was already released", protocol.tag(), tuple);
        }
        return true;
    }

    private void giveBack(boolean budgeted) {
        if (budgeted) {
            budget.release();
        }
    }

    private void report(String what, Throwable cause) {
        String diagnostic = protocol.tag() + " listener on " + tuple + ": " + what
                + System.lineSeparator() + stackTrace(cause);
        try {
            errorDelegate.onError(new ListenerErrorEvent(wallClock.now(), protocol, tuple, diagnostic, cause));
        } catch (RuntimeException delegateFailure) {
            log.debug("Error delegate for {} listener on {} failed", protocol.tag(), tuple, delegateFailure);
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
