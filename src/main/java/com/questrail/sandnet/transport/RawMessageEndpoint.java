package com.questrail.sandnet.transport;

/**
 * A bound UDP receiving handle. Non-blocking.
 */
public interface RawMessageEndpoint
{
    /**
     * Take one pending datagram.
     *
     * @throws com.questrail.sandnet.errors.WouldBlockException if none is pending
     */
    ReceivedMessage receive();

    void close();
}
