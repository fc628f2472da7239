package com.questrail.sandnet.transport;

/**
 * A bound TCP listening handle. Non-blocking.
 */
public interface RawListener
{
    /**
     * Take one pending inbound connection.
     *
     * @throws com.questrail.sandnet.errors.WouldBlockException if none is pending
     */
    AcceptedConnection accept();

    void close();
}
