package com.questrail.sandnet.listen;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.errors.DuplicateBindingException;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.internal.time.MonotonicScheduler;
import com.questrail.sandnet.internal.time.WallClock;
import com.questrail.sandnet.net.Ipv4Addresses;
import com.questrail.sandnet.observability.ListenerErrorDelegate;
import com.questrail.sandnet.ports.PortRegistry;
import com.questrail.sandnet.socket.SandboxSocketFactory;
import com.questrail.sandnet.transport.RawListener;
import com.questrail.sandnet.transport.RawMessageEndpoint;
import com.questrail.sandnet.transport.RawTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * ListenerManager
 * =============================================================================
 * Registers TCP and UDP listeners and runs their accept-poll tasks on the
 * scheduler.
 *
 * <h2>Registration</h2>
 * <ol>
 *   <li>validate arguments</li>
 *   <li>fail with {@link DuplicateBindingException} if the tuple is already
 *       bound by this layer</li>
 *   <li>open the raw listening handle, then register the tuple</li>
 *   <li>schedule the poll task every {@code pollInterval}</li>
 * </ol>
 * The returned {@link ListenerHandle} reverses all of it.
 *
 * <h2>Collaborators</h2>
 * The run-loop scheduler, event budget and thread factory are injected so
 * tests can substitute deterministic fakes. None of them is owned here.
 */
public final class ListenerManager {
    private static final Logger log = LoggerFactory.getLogger(ListenerManager.class);

    private final RawTransport transport;
    private final PortRegistry registry;
    private final SandboxSocketFactory sockets;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final EventBudget budget;
    private final ThreadFactory threadFactory;
    private final ListenerErrorDelegate defaultErrorDelegate;
    private final Duration defaultPollInterval;

    public ListenerManager(RawTransport transport,
                           PortRegistry registry,
                           SandboxSocketFactory sockets,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           WallClock wallClock,
                           EventBudget budget,
                           ThreadFactory threadFactory,
                           ListenerErrorDelegate defaultErrorDelegate,
                           Duration defaultPollInterval)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sockets = Objects.requireNonNull(sockets, "sockets");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.defaultErrorDelegate = Objects.requireNonNull(defaultErrorDelegate, "defaultErrorDelegate");
        this.defaultPollInterval = checkPollInterval(defaultPollInterval);
    }

    public ListenerHandle listenForConnection(String localAddress, int localPort, ConnectionCallback callback) {
        return listenForConnection(localAddress, localPort, callback, null, defaultPollInterval, null);
    }

    /**
     * Listen for TCP connections at {@code localAddress:localPort}.
     *
     * @param pool          worker pool for callbacks, or {@code null} to use a
     *                      new thread per connection, gated by the event budget
     * @param pollInterval  accept poll period, strictly positive
     * @param errorDelegate receiver of contained failures, or {@code null} for the default
     * @throws DuplicateBindingException if this layer already holds the tuple
     * @throws com.questrail.sandnet.errors.PortConflictException if the transport refuses the bind
     */
    public ListenerHandle listenForConnection(String localAddress, int localPort,
                                              ConnectionCallback callback,
                                              WorkerPool pool,
                                              Duration pollInterval,
                                              ListenerErrorDelegate errorDelegate) {
        Endpoint tuple = listenTuple(localAddress, localPort);
        Objects.requireNonNull(callback, "callback");
        Duration interval = checkPollInterval(pollInterval);

        registry.requireUnbound(tuple);
        RawListener raw = transport.listen(tuple.address(), tuple.port());
        register(Protocol.TCP, tuple, raw::close);

        TcpListener listener = new TcpListener(tuple, raw, sockets, callback, registry, pool, budget,
                threadFactory, delegateOrDefault(errorDelegate), wallClock);
        listener.start(scheduler, clock, interval);
        log.debug("TCP listener on {} polling every {}", tuple, interval);
        return listener;
    }

    public ListenerHandle listenForMessages(String localAddress, int localPort, MessageCallback callback) {
        return listenForMessages(localAddress, localPort, callback, null, defaultPollInterval, null);
    }

    /**
     * Listen for UDP datagrams at {@code localAddress:localPort}.
     *
     * @see #listenForConnection(String, int, ConnectionCallback, WorkerPool, Duration, ListenerErrorDelegate)
     */
    public ListenerHandle listenForMessages(String localAddress, int localPort,
                                            MessageCallback callback,
                                            WorkerPool pool,
                                            Duration pollInterval,
                                            ListenerErrorDelegate errorDelegate) {
        Endpoint tuple = listenTuple(localAddress, localPort);
        Objects.requireNonNull(callback, "callback");
        Duration interval = checkPollInterval(pollInterval);

        registry.requireUnbound(tuple);
        RawMessageEndpoint raw = transport.listenForMessages(tuple.address(), tuple.port());
        register(Protocol.UDP, tuple, raw::close);

        UdpListener listener = new UdpListener(tuple, raw, callback, registry, pool, budget,
                threadFactory, delegateOrDefault(errorDelegate), wallClock);
        listener.start(scheduler, clock, interval);
        log.debug("UDP listener on {} polling every {}", tuple, interval);
        return listener;
    }

    private void register(Protocol protocol, Endpoint tuple, Runnable closeRaw) {
        try {
            registry.register(protocol, tuple);
        } catch (DuplicateBindingException e) {
            // lost a race with a concurrent registration of the same tuple
            closeRaw.run();
            throw e;
        }
    }

    private ListenerErrorDelegate delegateOrDefault(ListenerErrorDelegate errorDelegate) {
        return errorDelegate != null ? errorDelegate : defaultErrorDelegate;
    }

    private static Endpoint listenTuple(String localAddress, int localPort) {
        Ipv4Addresses.requireDottedQuad(localAddress);
        if (localPort < 1 || localPort > 65535) {
            throw new IllegalArgumentException("listen port must be 1-65535: " + localPort);
        }
        return Endpoint.of(localAddress, localPort);
    }

    private static Duration checkPollInterval(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        return pollInterval;
    }
}
