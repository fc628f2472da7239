package com.questrail.sandnet.ports;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.errors.DuplicateBindingException;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * PortRegistry
 * =============================================================================
 * Single source of truth for "is this local endpoint already bound by this
 * layer". Holds one set of listening tuples per {@link Protocol}.
 *
 * <h2>Ownership</h2>
 * One instance is created by the composition root and injected into the port
 * allocator and the listener manager. There is no static instance.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A tuple is present in at most one protocol's set at a time.</li>
 *   <li>Entries are added when a listener starts and removed when it stops,
 *       including abnormal stops.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Every read and mutation runs under one monitor.
 */
public final class PortRegistry {

    private final Map<Protocol, Set<Endpoint>> tuples = new EnumMap<>(Protocol.class);

    public PortRegistry() {
        for (Protocol protocol : Protocol.values()) {
            tuples.put(protocol, new HashSet<>());
        }
    }

    /**
     * Record that a listener now owns {@code tuple}.
     *
     * @throws DuplicateBindingException if the tuple is already registered under any protocol
     */
    public synchronized void register(Protocol protocol, Endpoint tuple) {
        Objects.requireNonNull(protocol, "protocol");
        requireUnbound(tuple);
        tuples.get(protocol).add(tuple);
    }

    /**
     * @throws DuplicateBindingException if {@code tuple} is registered under any protocol
     */
    public synchronized void requireUnbound(Endpoint tuple) {
        Objects.requireNonNull(tuple, "tuple");
        for (Map.Entry<Protocol, Set<Endpoint>> entry : tuples.entrySet()) {
            if (entry.getValue().contains(tuple)) {
                throw new DuplicateBindingException(
                        tuple + " is already bound by a " + entry.getKey().tag() + " listener");
            }
        }
    }

    /**
     * Release {@code tuple}.
     *
     * @return {@code false} if it was not registered under {@code protocol}
     */
    public synchronized boolean deregister(Protocol protocol, Endpoint tuple) {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(tuple, "tuple");
        return tuples.get(protocol).remove(tuple);
    }

    public synchronized boolean isRegistered(Protocol protocol, Endpoint tuple) {
        return tuples.get(protocol).contains(tuple);
    }

    /**
     * Ports registered under {@code protocol} at {@code address}.
     */
    public synchronized SortedSet<Integer> portsInUse(Protocol protocol, String address) {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(address, "address");

        SortedSet<Integer> ports = new TreeSet<>();
        for (Endpoint tuple : tuples.get(protocol)) {
            if (tuple.address().equals(address)) {
                ports.add(tuple.port());
            }
        }
        return ports;
    }
}
