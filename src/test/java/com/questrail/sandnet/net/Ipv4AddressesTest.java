package com.questrail.sandnet.net;

import com.questrail.sandnet.errors.TransportException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Ipv4AddressesTest {

    @Test
    void acceptsFourDecimalOctets() {
        assertTrue(Ipv4Addresses.isDottedQuad("0.0.0.0"));
        assertTrue(Ipv4Addresses.isDottedQuad("255.255.255.255"));
        assertTrue(Ipv4Addresses.isDottedQuad("10.0.0.1"));
    }

    @Test
    void rejectsEverythingElse() {
        assertFalse(Ipv4Addresses.isDottedQuad(null));
        assertFalse(Ipv4Addresses.isDottedQuad(""));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0.1.2"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0.256"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0..1"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0.-1"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0.1000"));
        assertFalse(Ipv4Addresses.isDottedQuad("a.b.c.d"));
        assertFalse(Ipv4Addresses.isDottedQuad("::1"));
        assertFalse(Ipv4Addresses.isDottedQuad(" 10.0.0.1"));
    }

    @Test
    void rejectsNonAsciiDigits() {
        assertFalse(Ipv4Addresses.isDottedQuad("\u0661\u0660.0.0.1"));
        assertFalse(Ipv4Addresses.isDottedQuad("10.0.0.\uFF11"));
        assertThrows(IllegalArgumentException.class,
                () -> Ipv4Addresses.requireDottedQuad("\u0661\u0660.0.0.1"));
    }

    @Test
    void requireDottedQuadReturnsItsArgument() {
        assertEquals("10.0.0.1", Ipv4Addresses.requireDottedQuad("10.0.0.1"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Addresses.requireDottedQuad("example.com"));
    }

    @Test
    void literalsBypassResolution() {
        StaticHostResolver resolver = new StaticHostResolver("10.0.0.1").with("db.internal", "10.0.0.9");

        assertEquals("10.0.0.5", resolver.resolveIfNeeded("10.0.0.5"));
        assertEquals("10.0.0.9", resolver.resolveIfNeeded("db.internal"));
        assertThrows(TransportException.class, () -> resolver.resolveIfNeeded("unknown.internal"));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolveIfNeeded("  "));
    }

    @Test
    void inetResolverHandlesLiteralsAndLocalAddress() {
        assertEquals("127.0.0.1", InetHostResolver.INSTANCE.resolve("127.0.0.1"));
        assertTrue(Ipv4Addresses.isDottedQuad(InetHostResolver.INSTANCE.localAddress()));
    }
}
