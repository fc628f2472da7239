package com.questrail.sandnet.socket;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.errors.ConnectionClosedException;
import com.questrail.sandnet.errors.SandnetException;
import com.questrail.sandnet.transport.RawConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SandboxSocket
 * =============================================================================
 * A connected TCP socket with blocking semantics over a non-blocking
 * {@link RawConnection}.
 *
 * <h2>Timeout</h2>
 * <ul>
 *   <li>{@code null}: block until data or capacity is available or the
 *       connection ends (the initial state)</li>
 *   <li>{@link Duration#ZERO}: never block; would-block surfaces as
 *       {@link com.questrail.sandnet.errors.WouldBlockException}</li>
 *   <li>positive: block at most that long, polling every
 *       {@link #pollInterval()}, then fail with
 *       {@link com.questrail.sandnet.errors.OperationTimeoutException}</li>
 * </ul>
 * {@link #receiveAll(int)} and {@link #sendAll(byte[])} always wait without a
 * bound, whatever the timeout.
 *
 * <h2>Receive buffer</h2>
 * Raw reads are at least {@code receiveChunkSize} bytes. Bytes beyond what the
 * caller asked for are kept in a FIFO buffer and served, in order and exactly
 * once, by later receive calls before any further raw read.
 *
 * <h2>Thread Safety</h2>
 * All receive-path calls share one lock and all send-path calls another, so
 * concurrent calls in the same direction queue up while the two directions
 * proceed independently.
 *
 * <h2>Lifecycle</h2>
 * {@link #close()} is idempotent. A {@link Cleaner} closes the raw connection
 * if the socket becomes unreachable without being closed; that is a leak
 * safety net, not a closing strategy.
 */
public final class SandboxSocket implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SandboxSocket.class);

    private static final Cleaner CLEANER = Cleaner.create();
    private static final byte[] EMPTY = new byte[0];

    private final RawConnection connection;
    private final Endpoint localEndpoint;
    private final Endpoint remoteEndpoint;
    private final PollingWait wait;
    private final int receiveChunkSize;

    private final ReentrantLock receiveLock = new ReentrantLock();
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Cleaner.Cleanable cleanable;

    // guarded by receiveLock
    private byte[] pending = EMPTY;
    private int pendingOffset;

    private volatile Duration timeout;
    private volatile Duration pollInterval;

    SandboxSocket(RawConnection connection,
                  Endpoint localEndpoint,
                  Endpoint remoteEndpoint,
                  PollingWait wait,
                  Duration pollInterval,
                  int receiveChunkSize) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.localEndpoint = Objects.requireNonNull(localEndpoint, "localEndpoint");
        this.remoteEndpoint = Objects.requireNonNull(remoteEndpoint, "remoteEndpoint");
        this.wait = Objects.requireNonNull(wait, "wait");
        this.receiveChunkSize = receiveChunkSize;
        setPollInterval(pollInterval);

        this.cleanable = CLEANER.register(this, new RawCloser(connection, remoteEndpoint));
    }

    /**
     * Receive up to {@code n} bytes.
     *
     * <p>Buffered bytes are returned first without touching the transport,
     * even when fewer than {@code n} are buffered.</p>
     *
     * @throws IllegalArgumentException if {@code n <= 0}
     */
    public byte[] receive(int n) {
        requirePositive(n);
        receiveLock.lock();
        try {
            ensureOpen();
            return receiveBuffered(n, timeout);
        } finally {
            receiveLock.unlock();
        }
    }

    /**
     * Send as much of {@code data} as one raw write accepts.
     *
     * @return bytes written, possibly fewer than {@code data.length}
     */
    public int send(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (data.length == 0) {
            return 0;
        }
        sendLock.lock();
        try {
            ensureOpen();
            return wait.await(() -> connection.send(data), timeout, pollInterval, "send");
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Receive exactly {@code n} bytes, or fewer if the transport fails or the
     * peer closes first. Never throws for transport errors; a short result
     * signals early termination.
     */
    public byte[] receiveAll(int n) {
        requirePositive(n);
        receiveLock.lock();
        try {
            ByteArrayOutputStream collected = new ByteArrayOutputStream(n);
            while (collected.size() < n) {
                try {
                    ensureOpen();
                    collected.writeBytes(receiveBuffered(n - collected.size(), null));
                } catch (SandnetException e) {
                    log.debug("receiveAll from {} ended after {} of {} bytes: {}",
                            remoteEndpoint, collected.size(), n, e.toString());
                    break;
                }
            }
            return collected.toByteArray();
        } finally {
            receiveLock.unlock();
        }
    }

    /**
     * Send all of {@code data}, or as much as the transport takes before it
     * fails.
     *
     * @return bytes actually sent
     */
    public int sendAll(byte[] data) {
        Objects.requireNonNull(data, "data");
        sendLock.lock();
        try {
            int sent = 0;
            while (sent < data.length) {
                byte[] rest = sent == 0 ? data : Arrays.copyOfRange(data, sent, data.length);
                try {
                    ensureOpen();
                    sent += wait.await(() -> connection.send(rest), null, pollInterval, "send");
                } catch (SandnetException e) {
                    log.debug("sendAll to {} ended after {} of {} bytes: {}",
                            remoteEndpoint, sent, data.length, e.toString());
                    break;
                }
            }
            return sent;
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Close the underlying connection. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cleanable.clean();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Endpoint localEndpoint() {
        return localEndpoint;
    }

    public Endpoint remoteEndpoint() {
        return remoteEndpoint;
    }

    /**
     * @return the timeout, or {@code null} if calls block indefinitely
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * @param timeout {@code null} to block indefinitely, zero for non-blocking,
     *                or a positive bound
     * @throws IllegalArgumentException if negative
     */
    public void setTimeout(Duration timeout) {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative or null");
        }
        this.timeout = timeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * @throws IllegalArgumentException if {@code null}, zero or negative
     */
    public void setPollInterval(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
    }

    @Override
    public String toString() {
        return "SandboxSocket[" + localEndpoint + " -> " + remoteEndpoint + (closed.get() ? ", closed]" : "]");
    }

    private byte[] receiveBuffered(int n, Duration waitTimeout) {
        if (pendingOffset < pending.length) {
            return drainPending(n);
        }

        int request = Math.max(n, receiveChunkSize);
        byte[] raw = wait.await(() -> connection.receive(request), waitTimeout, pollInterval, "receive");
        if (raw.length <= n) {
            return raw;
        }
        pending = raw;
        pendingOffset = n;
        return Arrays.copyOf(raw, n);
    }

    private byte[] drainPending(int n) {
        int count = Math.min(n, pending.length - pendingOffset);
        byte[] out = Arrays.copyOfRange(pending, pendingOffset, pendingOffset + count);
        pendingOffset += count;
        if (pendingOffset == pending.length) {
            pending = EMPTY;
            pendingOffset = 0;
        }
        return out;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ConnectionClosedException("socket to " + remoteEndpoint + " is closed");
        }
    }

    private static void requirePositive(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("byte count must be positive: " + n);
        }
    }

    /**
     * Cleaning action. Must not reference the socket itself.
     */
    private static final class RawCloser implements Runnable {
        private final RawConnection connection;
        private final Endpoint remote;

        private RawCloser(RawConnection connection, Endpoint remote) {
            this.connection = connection;
            this.remote = remote;
        }

        @Override
        public void run() {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close connection to {}", remote, e);
            }
        }
    }
}
