package com.questrail.sandnet.net;

import com.questrail.sandnet.errors.TransportException;

import java.util.HashMap;
import java.util.Map;

/**
 * Table-driven {@link HostResolver} for tests.
 */
public final class StaticHostResolver implements HostResolver {

    private final String localAddress;
    private final Map<String, String> hosts = new HashMap<>();

    public StaticHostResolver(String localAddress) {
        this.localAddress = localAddress;
    }

    public StaticHostResolver with(String hostname, String address) {
        hosts.put(hostname, address);
        return this;
    }

    @Override
    public String localAddress() {
        return localAddress;
    }

    @Override
    public String resolve(String hostname) {
        String address = hosts.get(hostname);
        if (address == null) {
            throw new TransportException("unknown host " + hostname);
        }
        return address;
    }
}
