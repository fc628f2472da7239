package com.questrail.sandnet.net;

import com.questrail.sandnet.errors.TransportException;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Production {@link HostResolver} backed by {@link InetAddress}.
 *
 * <p>Only IPv4 results are accepted. If the local host name resolves to
 * something other than IPv4 the loopback address is used.</p>
 */
public enum InetHostResolver implements HostResolver {
    INSTANCE;

    private static final String LOOPBACK = "127.0.0.1";

    @Override
    public String localAddress() {
        try {
            InetAddress local = InetAddress.getLocalHost();
            return local instanceof Inet4Address ? local.getHostAddress() : LOOPBACK;
        } catch (UnknownHostException e) {
            return LOOPBACK;
        }
    }

    @Override
    public String resolve(String hostname) {
        try {
            for (InetAddress candidate : InetAddress.getAllByName(hostname)) {
                if (candidate instanceof Inet4Address) {
                    return candidate.getHostAddress();
                }
            }
        } catch (UnknownHostException e) {
            throw new TransportException("cannot resolve host " + hostname, e);
        }
        throw new TransportException("no IPv4 address for host " + hostname);
    }
}
