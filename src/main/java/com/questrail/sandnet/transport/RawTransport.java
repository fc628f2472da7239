package com.questrail.sandnet.transport;

import java.time.Duration;

/**
 * RawTransport
 * -----------------------------------------------------------------------------
 * Port for the sandbox's primitive networking calls.
 *
 * <p>Every call either completes or fails at once: nothing here waits for
 * data or capacity. Blocking behaviour, retries and port rotation are layered
 * on top by the connect, socket and listen packages.</p>
 *
 * <h2>Error contract</h2>
 * <ul>
 *   <li>{@link com.questrail.sandnet.errors.AlreadyInUseException}: the local
 *       tuple is held by someone else</li>
 *   <li>{@link com.questrail.sandnet.errors.DuplicateBindingException}: the
 *       identical tuple is already bound through this transport</li>
 *   <li>{@link com.questrail.sandnet.errors.CleanupInProgressException}: a
 *       previous binding of the tuple is still tearing down (connect only)</li>
 *   <li>{@link com.questrail.sandnet.errors.TransportException}: anything else</li>
 * </ul>
 */
public interface RawTransport
{
    /**
     * Open an outbound TCP connection from {@code localAddress:localPort}.
     *
     * @param timeout the longest this single attempt may take
     */
    RawConnection connect(String remoteAddress, int remotePort,
                          String localAddress, int localPort,
                          Duration timeout);

    /**
     * Bind a TCP listening handle at the tuple.
     */
    RawListener listen(String localAddress, int localPort);

    /**
     * Bind a UDP receiving handle at the tuple.
     */
    RawMessageEndpoint listenForMessages(String localAddress, int localPort);

    /**
     * Send one datagram from {@code localAddress:localPort}.
     *
     * @return the number of payload bytes the transport accepted
     */
    int sendMessage(String remoteAddress, int remotePort, byte[] payload,
                    String localAddress, int localPort);
}
