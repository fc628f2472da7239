package com.questrail.sandnet.connect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Ascending queue of local ports for one outbound attempt, skipping the port
 * that would connect the local endpoint to itself.
 */
final class LocalPortCandidates {

    private final Deque<Integer> remaining;
    private final int selfLoopPort;

    /**
     * @param ports        ascending available ports
     * @param selfLoopPort port to skip, or -1 when local and remote addresses differ
     */
    LocalPortCandidates(List<Integer> ports, int selfLoopPort) {
        this.remaining = new ArrayDeque<>(ports);
        this.selfLoopPort = selfLoopPort;
    }

    static LocalPortCandidates forRemote(List<Integer> ports, String localAddress,
                                         String remoteAddress, int remotePort) {
        return new LocalPortCandidates(ports, localAddress.equals(remoteAddress) ? remotePort : -1);
    }

    /**
     * @return the next usable port, or -1 when none remain
     */
    int next() {
        while (!remaining.isEmpty()) {
            int port = remaining.pollFirst();
            if (port != selfLoopPort) {
                return port;
            }
        }
        return -1;
    }
}
