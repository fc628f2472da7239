package com.questrail.sandnet.transport;

import com.questrail.sandnet.errors.ConnectionClosedException;
import com.questrail.sandnet.errors.WouldBlockException;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * ScriptedConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link RawConnection} whose reads and writes follow a script.
 *
 * <p>Receive steps are chunks of bytes or exceptions. A chunk larger than the
 * requested size is split and its tail stays at the head of the script, the
 * way a stream transport behaves. When the script is empty the connection
 * reports would-block, or closed once {@link #closeFromPeer()} was called.</p>
 *
 * <p>Send steps are per-call limits (how many bytes one write accepts) or
 * exceptions. With no step queued every write is accepted in full.</p>
 */
public final class ScriptedConnection implements RawConnection {

    private final Deque<Object> receiveScript = new ArrayDeque<>();
    private final Deque<Object> sendScript = new ArrayDeque<>();
    private final List<Integer> receiveRequests = new ArrayList<>();
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();

    private boolean peerClosed;
    private int closeCount;
    private Runnable onClose = () -> { };

    @Override
    public synchronized int send(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (closeCount > 0) {
            throw new ConnectionClosedException("closed");
        }
        Object step = sendScript.pollFirst();
        if (step instanceof RuntimeException) {
            throw (RuntimeException) step;
        }
        int accepted = step == null ? data.length : Math.min((Integer) step, data.length);
        written.write(data, 0, accepted);
        return accepted;
    }

    @Override
    public synchronized byte[] receive(int maxBytes) {
        receiveRequests.add(maxBytes);
        if (closeCount > 0) {
            throw new ConnectionClosedException("closed");
        }
        Object step = receiveScript.pollFirst();
        if (step == null) {
            if (peerClosed) {
                throw new ConnectionClosedException("peer closed");
            }
            throw new WouldBlockException("nothing to read");
        }
        if (step instanceof RuntimeException) {
            throw (RuntimeException) step;
        }
        byte[] chunk = (byte[]) step;
        if (chunk.length > maxBytes) {
            receiveScript.addFirst(Arrays.copyOfRange(chunk, maxBytes, chunk.length));
            return Arrays.copyOf(chunk, maxBytes);
        }
        return chunk;
    }

    @Override
    public void close() {
        Runnable hook;
        synchronized (this) {
            closeCount++;
            hook = onClose;
        }
        hook.run();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized ScriptedConnection deliver(byte[] chunk) {
        receiveScript.addLast(chunk.clone());
        return this;
    }

    public synchronized ScriptedConnection wouldBlockOnce() {
        receiveScript.addLast(new WouldBlockException("scripted would-block"));
        return this;
    }

    public synchronized ScriptedConnection failReceive(RuntimeException failure) {
        receiveScript.addLast(failure);
        return this;
    }

    public synchronized ScriptedConnection acceptNextWrite(int bytes) {
        sendScript.addLast(bytes);
        return this;
    }

    public synchronized ScriptedConnection failNextWrite(RuntimeException failure) {
        sendScript.addLast(failure);
        return this;
    }

    /**
     * Reads report closed once the script is drained.
     */
    public synchronized ScriptedConnection closeFromPeer() {
        peerClosed = true;
        return this;
    }

    synchronized void onClose(Runnable hook) {
        this.onClose = hook;
    }

    public synchronized List<Integer> receiveRequests() {
        return new ArrayList<>(receiveRequests);
    }

    public synchronized byte[] written() {
        return written.toByteArray();
    }

    public synchronized boolean isClosed() {
        return closeCount > 0;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
