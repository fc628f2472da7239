package com.questrail.sandnet.listen;

import com.questrail.sandnet.socket.SandboxSocket;

/**
 * Receives each connection accepted by a TCP listener.
 *
 * <p>Runs on a worker-pool thread or a dedicated thread, never on the
 * scheduler. If it throws, the socket is closed and the failure goes to the
 * listener's error delegate.</p>
 */
@FunctionalInterface
public interface ConnectionCallback {
    void onConnection(SandboxSocket socket) throws Exception;
}
