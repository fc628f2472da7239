package com.questrail.sandnet.transport;

import com.questrail.sandnet.api.Endpoint;

import java.util.Objects;

/**
 * One inbound datagram and the endpoint it came from.
 *
 * <p>The payload is treated as an atomic unit; no streaming assumptions are
 * made at this boundary.</p>
 */
public record ReceivedMessage(Endpoint remote, byte[] payload) {
    public ReceivedMessage {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
    }
}
