package com.questrail.sandnet.ports;

import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.errors.ResourceExhaustedException;
import com.questrail.sandnet.net.HostResolver;
import com.questrail.sandnet.net.Ipv4Addresses;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * PortAllocator
 * =============================================================================
 * Computes the local ports an outbound connection or datagram may use.
 *
 * <p>The candidate set is the configured allowed range for the protocol minus
 * every port a listener of the same protocol currently holds at the same
 * address. Results are always ascending, which fixes the rotation order used
 * by the connection establisher and message sender.</p>
 */
public final class PortAllocator {

    private final PortRegistry registry;
    private final HostResolver resolver;
    private final SortedSet<Integer> connectPorts;
    private final SortedSet<Integer> messagePorts;

    public PortAllocator(PortRegistry registry,
                         HostResolver resolver,
                         SortedSet<Integer> connectPorts,
                         SortedSet<Integer> messagePorts) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.connectPorts = Objects.requireNonNull(connectPorts, "connectPorts");
        this.messagePorts = Objects.requireNonNull(messagePorts, "messagePorts");
    }

    /**
     * Local TCP ports free for an outbound connection from {@code localAddress}.
     *
     * @param localAddress dotted-quad address, or {@code null} for the machine's address
     * @throws ResourceExhaustedException if no port is free
     * @throws IllegalArgumentException if the address is malformed
     */
    public List<Integer> availableConnectPorts(String localAddress) {
        return available(Protocol.TCP, connectPorts, localAddress);
    }

    /**
     * Local UDP ports free for an outbound datagram from {@code localAddress}.
     *
     * @param localAddress dotted-quad address, or {@code null} for the machine's address
     * @throws ResourceExhaustedException if no port is free
     * @throws IllegalArgumentException if the address is malformed
     */
    public List<Integer> availableMessagePorts(String localAddress) {
        return available(Protocol.UDP, messagePorts, localAddress);
    }

    /**
     * {@code localAddress}, or the machine's address when it is {@code null}.
     */
    public String localAddressOrDefault(String localAddress) {
        if (localAddress == null) {
            return resolver.localAddress();
        }
        return Ipv4Addresses.requireDottedQuad(localAddress);
    }

    private List<Integer> available(Protocol protocol, SortedSet<Integer> allowed, String localAddress) {
        String address = localAddressOrDefault(localAddress);
        SortedSet<Integer> inUse = registry.portsInUse(protocol, address);

        List<Integer> result = new ArrayList<>(allowed.size());
        for (Integer port : allowed) {
            if (!inUse.contains(port)) {
                result.add(port);
            }
        }
        if (result.isEmpty()) {
            throw new ResourceExhaustedException(
                    "no " + protocol.tag() + " ports available at " + address);
        }
        return result;
    }
}
