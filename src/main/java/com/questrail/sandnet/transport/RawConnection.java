package com.questrail.sandnet.transport;

/**
 * One established TCP connection on the raw transport. Non-blocking.
 */
public interface RawConnection
{
    /**
     * Write as much of {@code data} as the transport will take right now.
     *
     * @return bytes accepted, possibly fewer than {@code data.length}
     * @throws com.questrail.sandnet.errors.WouldBlockException if nothing can be written now
     * @throws com.questrail.sandnet.errors.ConnectionClosedException if the connection is closed
     */
    int send(byte[] data);

    /**
     * Read up to {@code maxBytes} of whatever has arrived.
     *
     * @return at least one byte
     * @throws com.questrail.sandnet.errors.WouldBlockException if nothing has arrived
     * @throws com.questrail.sandnet.errors.ConnectionClosedException once the peer has closed
     *         and all data has been read
     */
    byte[] receive(int maxBytes);

    /**
     * Close the connection. Closing twice has no further effect.
     */
    void close();
}
