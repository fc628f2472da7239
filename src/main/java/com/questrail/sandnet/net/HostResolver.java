package com.questrail.sandnet.net;

/**
 * HostResolver
 * -----------------------------------------------------------------------------
 * Environment port for name resolution.
 *
 * <p>Resolution itself is out of scope for this layer; implementations may be
 * backed by {@link java.net.InetAddress}, a static table, or a test double.</p>
 */
public interface HostResolver
{
    /**
     * The machine's own IPv4 address, used when a caller does not pin a local
     * address.
     */
    String localAddress();

    /**
     * Resolve a hostname to a dotted-quad IPv4 address.
     *
     * @throws com.questrail.sandnet.errors.TransportException if the name cannot be resolved
     */
    String resolve(String hostname);

    /**
     * Returns {@code host} unchanged if it is already an IPv4 literal,
     * otherwise resolves it.
     */
    default String resolveIfNeeded(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        return Ipv4Addresses.isDottedQuad(host) ? host : resolve(host);
    }
}
