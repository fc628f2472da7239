package com.questrail.sandnet.api;

/**
 * Transport protocol a local tuple is bound under.
 */
public enum Protocol
{
    TCP("TCP"),
    UDP("UDP");

    private final String tag;

    Protocol(String tag) {
        this.tag = tag;
    }

    /**
     * Short tag used in diagnostics.
     */
    public String tag() {
        return tag;
    }
}
