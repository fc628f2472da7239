package com.questrail.sandnet.runtime;

import com.questrail.sandnet.config.SandnetConfig;
import com.questrail.sandnet.connect.ConnectionEstablisher;
import com.questrail.sandnet.connect.MessageSender;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.internal.time.MonotonicScheduler;
import com.questrail.sandnet.internal.time.ScheduledExecutorScheduler;
import com.questrail.sandnet.internal.time.Sleeper;
import com.questrail.sandnet.internal.time.SystemMonotonicClock;
import com.questrail.sandnet.internal.time.SystemSleeper;
import com.questrail.sandnet.internal.time.SystemWallClock;
import com.questrail.sandnet.listen.ConnectionCallback;
import com.questrail.sandnet.listen.EventBudget;
import com.questrail.sandnet.listen.ListenerHandle;
import com.questrail.sandnet.listen.ListenerManager;
import com.questrail.sandnet.listen.MessageCallback;
import com.questrail.sandnet.listen.SemaphoreEventBudget;
import com.questrail.sandnet.listen.WorkerPool;
import com.questrail.sandnet.net.HostResolver;
import com.questrail.sandnet.net.InetHostResolver;
import com.questrail.sandnet.observability.ListenerErrorDelegate;
import com.questrail.sandnet.observability.Slf4jListenerErrorDelegate;
import com.questrail.sandnet.ports.PortAllocator;
import com.questrail.sandnet.ports.PortRegistry;
import com.questrail.sandnet.socket.SandboxSocket;
import com.questrail.sandnet.socket.SandboxSocketFactory;
import com.questrail.sandnet.transport.RawTransport;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SandnetRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the sandnet stack.
 *
 * <p>Creates one {@link PortRegistry} and injects it into the allocator and
 * the listener manager; every other collaborator (transport, resolver,
 * clock, sleeper, scheduler, event budget, thread factory) is supplied
 * through the builder or defaulted here.</p>
 *
 * <h2>Ownership</h2>
 * When no scheduler is supplied the runtime creates a single-threaded
 * scheduled executor for listener polling and shuts it down in
 * {@link #close()}. A supplied scheduler and the transport are not owned.
 */
public final class SandnetRuntime implements AutoCloseable {
    private final PortRegistry registry;
    private final PortAllocator allocator;
    private final ConnectionEstablisher establisher;
    private final MessageSender sender;
    private final ListenerManager listeners;
    private final ScheduledExecutorService ownedExecutor;

    private SandnetRuntime(PortRegistry registry,
                           PortAllocator allocator,
                           ConnectionEstablisher establisher,
                           MessageSender sender,
                           ListenerManager listeners,
                           ScheduledExecutorService ownedExecutor) {
        this.registry = registry;
        this.allocator = allocator;
        this.establisher = establisher;
        this.sender = sender;
        this.listeners = listeners;
        this.ownedExecutor = ownedExecutor;
    }

    public SandboxSocket openConnection(String remoteHost, int remotePort) {
        return establisher.openConnection(remoteHost, remotePort);
    }

    public SandboxSocket openConnection(String remoteHost, int remotePort, Duration timeout) {
        return establisher.openConnection(remoteHost, remotePort, timeout);
    }

    public SandboxSocket openConnection(String remoteHost, int remotePort,
                                        String localAddress, int localPort, Duration timeout) {
        return establisher.openConnection(remoteHost, remotePort, localAddress, localPort, timeout);
    }

    public int sendMessage(String remoteHost, int remotePort, byte[] payload) {
        return sender.sendMessage(remoteHost, remotePort, payload);
    }

    public int sendMessage(String remoteHost, int remotePort, byte[] payload,
                           String localAddress, int localPort) {
        return sender.sendMessage(remoteHost, remotePort, payload, localAddress, localPort);
    }

    public ListenerHandle listenForConnection(String localAddress, int localPort, ConnectionCallback callback) {
        return listeners.listenForConnection(localAddress, localPort, callback);
    }

    public ListenerHandle listenForConnection(String localAddress, int localPort, ConnectionCallback callback,
                                              WorkerPool pool, Duration pollInterval,
                                              ListenerErrorDelegate errorDelegate) {
        return listeners.listenForConnection(localAddress, localPort, callback, pool, pollInterval, errorDelegate);
    }

    public ListenerHandle listenForMessages(String localAddress, int localPort, MessageCallback callback) {
        return listeners.listenForMessages(localAddress, localPort, callback);
    }

    public ListenerHandle listenForMessages(String localAddress, int localPort, MessageCallback callback,
                                            WorkerPool pool, Duration pollInterval,
                                            ListenerErrorDelegate errorDelegate) {
        return listeners.listenForMessages(localAddress, localPort, callback, pool, pollInterval, errorDelegate);
    }

    public List<Integer> availableConnectPorts(String localAddress) {
        return allocator.availableConnectPorts(localAddress);
    }

    public List<Integer> availableMessagePorts(String localAddress) {
        return allocator.availableMessagePorts(localAddress);
    }

    public PortRegistry portRegistry() {
        return registry;
    }

    /**
     * Shut down the scheduler executor if this runtime created it. Listeners
     * should be stopped first; their tuples stay registered otherwise.
     */
    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SandnetConfig config;
        private RawTransport transport;
        private HostResolver hostResolver = InetHostResolver.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = SystemSleeper.INSTANCE;
        private MonotonicScheduler scheduler;
        private EventBudget eventBudget;
        private ThreadFactory threadFactory;
        private ListenerErrorDelegate errorDelegate = Slf4jListenerErrorDelegate.INSTANCE;

        public Builder withConfig(SandnetConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(RawTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withHostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withEventBudget(EventBudget eventBudget) {
            this.eventBudget = eventBudget;
            return this;
        }

        public Builder withThreadFactory(ThreadFactory threadFactory) {
            this.threadFactory = threadFactory;
            return this;
        }

        public Builder withErrorDelegate(ListenerErrorDelegate errorDelegate) {
            this.errorDelegate = errorDelegate;
            return this;
        }

        public SandnetRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(hostResolver, "hostResolver");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(sleeper, "sleeper");
            Objects.requireNonNull(errorDelegate, "errorDelegate");

            // 1. Run-loop scheduler, owned only if we create it
            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler loop = scheduler;
            if (loop == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("sandnet-poll"));
                loop = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            // 2. Shared state and sockets
            PortRegistry registry = new PortRegistry();
            PortAllocator allocator = new PortAllocator(registry, hostResolver,
                    config.connectPorts(), config.messagePorts());
            SandboxSocketFactory sockets = new SandboxSocketFactory(clock, sleeper,
                    config.timing().socketPollInterval(), config.receiveChunkSize());

            // 3. Outbound and inbound paths
            ConnectionEstablisher establisher = new ConnectionEstablisher(transport, allocator, hostResolver,
                    sockets, clock, config.timing());
            MessageSender sender = new MessageSender(transport, allocator, hostResolver);
            ListenerManager listeners = new ListenerManager(
                    transport,
                    registry,
                    sockets,
                    loop,
                    clock,
                    SystemWallClock.INSTANCE,
                    eventBudget != null ? eventBudget : new SemaphoreEventBudget(config.maxConcurrentEvents()),
                    threadFactory != null ? threadFactory : daemonThreads("sandnet-callback"),
                    errorDelegate,
                    config.timing().listenerPollInterval()
            );

            return new SandnetRuntime(registry, allocator, establisher, sender, listeners, ownedExecutor);
        }

        private static ThreadFactory daemonThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
