package com.questrail.sandnet.listen;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.internal.time.WallClock;
import com.questrail.sandnet.observability.ListenerErrorDelegate;
import com.questrail.sandnet.ports.PortRegistry;
import com.questrail.sandnet.transport.RawMessageEndpoint;
import com.questrail.sandnet.transport.ReceivedMessage;

import java.util.concurrent.ThreadFactory;

/**
 * Receives datagrams and hands each to the callback.
 */
final class UdpListener extends PollingListener<ReceivedMessage> {

    private final RawMessageEndpoint raw;
    private final MessageCallback callback;

    UdpListener(Endpoint tuple,
                RawMessageEndpoint raw,
                MessageCallback callback,
                PortRegistry registry,
                WorkerPool pool,
                EventBudget budget,
                ThreadFactory threadFactory,
                ListenerErrorDelegate errorDelegate,
                WallClock wallClock) {
        super(Protocol.UDP, tuple, registry, pool, budget, threadFactory, errorDelegate, wallClock);
        this.raw = raw;
        this.callback = callback;
    }

    @Override
    protected ReceivedMessage take() {
        return raw.receive();
    }

    @Override
    protected void deliver(ReceivedMessage message) throws Exception {
        callback.onMessage(message);
    }

    @Override
    protected void closeRaw() {
        raw.close();
    }
}
