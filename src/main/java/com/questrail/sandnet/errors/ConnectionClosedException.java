package com.questrail.sandnet.errors;

/**
 * The connection has been closed, locally or by the peer.
 */
public final class ConnectionClosedException extends TransportException
{
    public ConnectionClosedException(String message) {
        super(message);
    }
}
