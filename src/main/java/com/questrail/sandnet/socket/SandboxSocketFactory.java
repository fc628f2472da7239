package com.questrail.sandnet.socket;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.internal.time.Sleeper;
import com.questrail.sandnet.transport.RawConnection;

import java.time.Duration;
import java.util.Objects;

/**
 * Wraps raw connections into {@link SandboxSocket}s sharing one clock,
 * sleeper, default poll interval and receive chunk size.
 */
public final class SandboxSocketFactory {

    private final PollingWait wait;
    private final Duration pollInterval;
    private final int receiveChunkSize;

    public SandboxSocketFactory(MonotonicClock clock, Sleeper sleeper, Duration pollInterval, int receiveChunkSize) {
        this.wait = new PollingWait(clock, sleeper);
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (receiveChunkSize <= 0) {
            throw new IllegalArgumentException("receiveChunkSize must be positive");
        }
        this.receiveChunkSize = receiveChunkSize;
    }

    public SandboxSocket wrap(RawConnection connection, Endpoint local, Endpoint remote) {
        return new SandboxSocket(connection, local, remote, wait, pollInterval, receiveChunkSize);
    }

    /**
     * The wait shared by every socket from this factory; the connect path uses
     * it for cleanup backoff.
     */
    public PollingWait pollingWait() {
        return wait;
    }
}
