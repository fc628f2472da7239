package com.questrail.sandnet.transport;

import com.questrail.sandnet.api.Endpoint;

import java.util.Objects;

/**
 * A connection taken from a {@link RawListener}, with the peer's endpoint.
 */
public record AcceptedConnection(Endpoint remote, RawConnection connection) {
    public AcceptedConnection {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(connection, "connection");
    }
}
