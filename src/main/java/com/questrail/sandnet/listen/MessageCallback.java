package com.questrail.sandnet.listen;

import com.questrail.sandnet.transport.ReceivedMessage;

/**
 * Receives each datagram taken by a UDP listener.
 *
 * <p>Runs on a worker-pool thread or a dedicated thread, never on the
 * scheduler. If it throws, the failure goes to the listener's error
 * delegate.</p>
 */
@FunctionalInterface
public interface MessageCallback {
    void onMessage(ReceivedMessage message) throws Exception;
}
