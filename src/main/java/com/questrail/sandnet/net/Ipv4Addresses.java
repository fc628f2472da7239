package com.questrail.sandnet.net;

import io.netty.util.NetUtil;

/**
 * Validation helpers for dotted-quad IPv4 literals.
 */
public final class Ipv4Addresses {

    private Ipv4Addresses() {
    }

    /**
     * Returns {@code true} if {@code candidate} is four dot-separated ASCII
     * decimal octets, each 0-255.
     */
    public static boolean isDottedQuad(String candidate) {
        return candidate != null && NetUtil.isValidIpV4Address(candidate);
    }

    /**
     * @throws IllegalArgumentException if {@code candidate} is not a dotted-quad literal
     */
    public static String requireDottedQuad(String candidate) {
        if (!isDottedQuad(candidate)) {
            throw new IllegalArgumentException("not a dotted-quad IPv4 address: " + candidate);
        }
        return candidate;
    }
}
