package com.questrail.sandnet.api;

import com.questrail.sandnet.net.Ipv4Addresses;

/**
 * Endpoint
 * =============================================================================
 * An {@code (address, port)} pair. Used both for the local and remote ends of
 * a connection and as the listening tuple tracked by the port registry.
 *
 * <p>The address is always a dotted-quad IPv4 literal; hostnames are resolved
 * before an endpoint is built.</p>
 */
public record Endpoint(String address, int port)
{
    public Endpoint {
        Ipv4Addresses.requireDottedQuad(address);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535: " + port);
        }
    }

    public static Endpoint of(String address, int port) {
        return new Endpoint(address, port);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
