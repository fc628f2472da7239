package com.questrail.sandnet.connect;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.config.SandnetTimingPolicy;
import com.questrail.sandnet.errors.CleanupInProgressException;
import com.questrail.sandnet.errors.OperationTimeoutException;
import com.questrail.sandnet.errors.PortConflictException;
import com.questrail.sandnet.errors.ResourceExhaustedException;
import com.questrail.sandnet.internal.time.MonotonicClock;
import com.questrail.sandnet.net.HostResolver;
import com.questrail.sandnet.ports.PortAllocator;
import com.questrail.sandnet.socket.PollingWait;
import com.questrail.sandnet.socket.SandboxSocket;
import com.questrail.sandnet.socket.SandboxSocketFactory;
import com.questrail.sandnet.transport.RawConnection;
import com.questrail.sandnet.transport.RawTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectionEstablisher
 * =============================================================================
 * Opens outbound TCP connections under a wall-time deadline, rotating through
 * local ports when the transport reports transient or foreign conflicts.
 *
 * <h2>Why rotate</h2>
 * The sandbox shares one port namespace between many parties. "In use by
 * someone else" and "cleanup not finished" are routine and not permanent, and
 * retrying the same port burns the deadline. When the caller left the local
 * port open ({@code localPort == 0}) candidates are tried in ascending order.
 *
 * <h2>Decision table</h2>
 * <pre>
 *   condition        auto port                      pinned port
 *   ---------------  -----------------------------  ----------------
 *   hard conflict    next port / ResourceExhausted  propagate
 *   cleanup          next port / backoff + retry    backoff + retry
 * </pre>
 * Once cleanup has been observed and no more than {@code cleanupThreshold}
 * remains, no further attempt is made and {@link CleanupInProgressException}
 * is raised; otherwise an expired deadline raises
 * {@link OperationTimeoutException}.
 *
 * <p>Outbound connections are never recorded in the port registry.</p>
 */
public final class ConnectionEstablisher {
    private static final Logger log = LoggerFactory.getLogger(ConnectionEstablisher.class);

    private final RawTransport transport;
    private final PortAllocator allocator;
    private final HostResolver resolver;
    private final SandboxSocketFactory sockets;
    private final MonotonicClock clock;
    private final SandnetTimingPolicy timing;
    private final PollingWait backoff;

    public ConnectionEstablisher(RawTransport transport,
                                 PortAllocator allocator,
                                 HostResolver resolver,
                                 SandboxSocketFactory sockets,
                                 MonotonicClock clock,
                                 SandnetTimingPolicy timing) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sockets = Objects.requireNonNull(sockets, "sockets");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.backoff = sockets.pollingWait();
    }

    public SandboxSocket openConnection(String remoteHost, int remotePort) {
        return openConnection(remoteHost, remotePort, null, 0, timing.connectTimeout());
    }

    public SandboxSocket openConnection(String remoteHost, int remotePort, Duration timeout) {
        return openConnection(remoteHost, remotePort, null, 0, timeout);
    }

    /**
     * Open a connection to {@code remoteHost:remotePort}.
     *
     * @param localAddress local IPv4 address, or {@code null} for the machine's address
     * @param localPort    local port, or 0 to pick one automatically
     * @param timeout      strictly positive deadline for the whole operation
     * @throws IllegalArgumentException     on a malformed argument
     * @throws ResourceExhaustedException   if every candidate port conflicted
     * @throws PortConflictException        if a pinned port conflicted
     * @throws CleanupInProgressException   if the tuple was still tearing down at the deadline
     * @throws OperationTimeoutException    if the deadline passed
     */
    public SandboxSocket openConnection(String remoteHost, int remotePort,
                                        String localAddress, int localPort,
                                        Duration timeout) {
        checkRemotePort(remotePort);
        checkLocalPort(localPort);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        String remoteAddress = resolver.resolveIfNeeded(remoteHost);
        String local = allocator.localAddressOrDefault(localAddress);

        boolean autoPort = localPort == 0;
        LocalPortCandidates candidates = null;
        int port = localPort;
        if (autoPort) {
            candidates = LocalPortCandidates.forRemote(
                    allocator.availableConnectPorts(local), local, remoteAddress, remotePort);
            port = candidates.next();
            if (port < 0) {
                throw new ResourceExhaustedException("no local TCP port available for " + remoteAddress + ":" + remotePort);
            }
        }

        long deadline = clock.nowNanos() + timeout.toNanos();
        long cleanupThreshold = timing.cleanupThreshold().toNanos();
        boolean cleanupObserved = false;
        RawConnection connection = null;

        while (true) {
            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                break;
            }
            if (cleanupObserved && remaining <= cleanupThreshold) {
                break;
            }

            try {
                connection = transport.connect(remoteAddress, remotePort, local, port, Duration.ofNanos(remaining));
                break;
            } catch (CleanupInProgressException e) {
                cleanupObserved = true;
                int next = autoPort ? candidates.next() : -1;
                if (next >= 0) {
                    log.debug("Local port {} still cleaning up, rotating to {}", port, next);
                    port = next;
                } else {
                    log.debug("Local port {} still cleaning up, backing off {}", port, timing.cleanupBackoff());
                    backoff.pause(timing.cleanupBackoff(), "connect");
                }
            } catch (PortConflictException e) {
                if (!autoPort) {
                    throw e;
                }
                cleanupObserved = false;
                int next = candidates.next();
                if (next < 0) {
                    throw new ResourceExhaustedException(
                            "all local TCP ports conflicted connecting to " + remoteAddress + ":" + remotePort, e);
                }
                log.debug("Local port {} in conflict ({}), rotating to {}", port, e.getMessage(), next);
                port = next;
            }
        }

        if (connection != null) {
            return sockets.wrap(connection, Endpoint.of(local, port), Endpoint.of(remoteAddress, remotePort));
        }
        if (cleanupObserved) {
            throw new CleanupInProgressException(
                    "local tuple " + local + ":" + port + " still cleaning up at deadline");
        }
        throw new OperationTimeoutException(
                "connect to " + remoteAddress + ":" + remotePort + " timed out after " + timeout.toMillis() + "ms");
    }

    static void checkRemotePort(int remotePort) {
        if (remotePort < 1 || remotePort > 65535) {
            throw new IllegalArgumentException("remote port must be 1-65535: " + remotePort);
        }
    }

    static void checkLocalPort(int localPort) {
        if (localPort < 0 || localPort > 65535) {
            throw new IllegalArgumentException("local port must be 0-65535: " + localPort);
        }
    }
}
