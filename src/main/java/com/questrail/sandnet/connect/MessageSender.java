package com.questrail.sandnet.connect;

import com.questrail.sandnet.errors.PortConflictException;
import com.questrail.sandnet.errors.ResourceExhaustedException;
import com.questrail.sandnet.net.HostResolver;
import com.questrail.sandnet.ports.PortAllocator;
import com.questrail.sandnet.transport.RawTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * MessageSender
 * =============================================================================
 * Sends single UDP datagrams, rotating through local ports on conflict when
 * the caller did not pin one.
 *
 * <p>Unlike {@link ConnectionEstablisher} there is no deadline loop and no
 * cleanup handling: a connectionless send has no teardown state, so each
 * candidate gets exactly one attempt.</p>
 */
public final class MessageSender {
    private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

    private final RawTransport transport;
    private final PortAllocator allocator;
    private final HostResolver resolver;

    public MessageSender(RawTransport transport, PortAllocator allocator, HostResolver resolver) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public int sendMessage(String remoteHost, int remotePort, byte[] payload) {
        return sendMessage(remoteHost, remotePort, payload, null, 0);
    }

    /**
     * Send {@code payload} as one datagram.
     *
     * @param localAddress local IPv4 address, or {@code null} for the machine's address
     * @param localPort    local port, or 0 to pick one automatically
     * @return bytes accepted by the transport
     * @throws ResourceExhaustedException if every candidate port conflicted
     * @throws PortConflictException      if a pinned port conflicted
     */
    public int sendMessage(String remoteHost, int remotePort, byte[] payload,
                           String localAddress, int localPort) {
        Objects.requireNonNull(payload, "payload");
        ConnectionEstablisher.checkRemotePort(remotePort);
        ConnectionEstablisher.checkLocalPort(localPort);

        String remoteAddress = resolver.resolveIfNeeded(remoteHost);
        String local = allocator.localAddressOrDefault(localAddress);

        if (localPort != 0) {
            return transport.sendMessage(remoteAddress, remotePort, payload, local, localPort);
        }

        LocalPortCandidates candidates = LocalPortCandidates.forRemote(
                allocator.availableMessagePorts(local), local, remoteAddress, remotePort);
        PortConflictException lastConflict = null;
        for (int port = candidates.next(); port >= 0; port = candidates.next()) {
            try {
                return transport.sendMessage(remoteAddress, remotePort, payload, local, port);
            } catch (PortConflictException e) {
                log.debug("Local UDP port {} in conflict ({}), rotating", port, e.getMessage());
                lastConflict = e;
            }
        }
        throw new ResourceExhaustedException(
                "no local UDP port usable for " + remoteAddress + ":" + remotePort, lastConflict);
    }
}
