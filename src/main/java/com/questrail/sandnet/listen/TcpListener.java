package com.questrail.sandnet.listen;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.internal.time.WallClock;
import com.questrail.sandnet.observability.ListenerErrorDelegate;
import com.questrail.sandnet.ports.PortRegistry;
import com.questrail.sandnet.socket.SandboxSocket;
import com.questrail.sandnet.socket.SandboxSocketFactory;
import com.questrail.sandnet.transport.AcceptedConnection;
import com.questrail.sandnet.transport.RawListener;

import java.util.concurrent.ThreadFactory;

/**
 * Accepts connections and hands each to the callback as a {@link SandboxSocket}.
 * A socket whose callback throws is closed before the failure is reported.
 */
final class TcpListener extends PollingListener<SandboxSocket> {

    private final RawListener raw;
    private final SandboxSocketFactory sockets;
    private final ConnectionCallback callback;

    TcpListener(Endpoint tuple,
                RawListener raw,
                SandboxSocketFactory sockets,
                ConnectionCallback callback,
                PortRegistry registry,
                WorkerPool pool,
                EventBudget budget,
                ThreadFactory threadFactory,
                ListenerErrorDelegate errorDelegate,
                WallClock wallClock) {
        super(Protocol.TCP, tuple, registry, pool, budget, threadFactory, errorDelegate, wallClock);
        this.raw = raw;
        this.sockets = sockets;
        this.callback = callback;
    }

    @Override
    protected SandboxSocket take() {
        AcceptedConnection accepted = raw.accept();
        return sockets.wrap(accepted.connection(), tuple(), accepted.remote());
    }

    @Override
    protected void deliver(SandboxSocket socket) throws Exception {
        callback.onConnection(socket);
    }

    @Override
    protected void discard(SandboxSocket socket) {
        socket.close();
    }

    @Override
    protected void closeRaw() {
        raw.close();
    }
}
