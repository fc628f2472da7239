package com.questrail.sandnet.ports;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;
import com.questrail.sandnet.errors.DuplicateBindingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PortRegistryTest {

    private final PortRegistry registry = new PortRegistry();

    @Test
    void registeredTupleIsVisibleUnderItsProtocolOnly() {
        Endpoint tuple = Endpoint.of("10.0.0.1", 7000);
        registry.register(Protocol.TCP, tuple);

        assertTrue(registry.isRegistered(Protocol.TCP, tuple));
        assertFalse(registry.isRegistered(Protocol.UDP, tuple));
        assertEquals(Set.of(7000), registry.portsInUse(Protocol.TCP, "10.0.0.1"));
        assertTrue(registry.portsInUse(Protocol.UDP, "10.0.0.1").isEmpty());
    }

    @Test
    void sameTupleCannotBeRegisteredTwiceUnderOneProtocol() {
        Endpoint tuple = Endpoint.of("10.0.0.1", 7000);
        registry.register(Protocol.UDP, tuple);

        assertThrows(DuplicateBindingException.class, () -> registry.register(Protocol.UDP, tuple));
    }

    @Test
    void tupleIsExclusiveAcrossProtocols() {
        Endpoint tuple = Endpoint.of("10.0.0.1", 7000);
        registry.register(Protocol.TCP, tuple);

        DuplicateBindingException e = assertThrows(DuplicateBindingException.class,
                () -> registry.register(Protocol.UDP, tuple));
        assertTrue(e.getMessage().contains("TCP"));
        assertFalse(registry.isRegistered(Protocol.UDP, tuple));
    }

    @Test
    void deregisterReportsWhetherTheTupleWasPresent() {
        Endpoint tuple = Endpoint.of("10.0.0.1", 7000);
        registry.register(Protocol.TCP, tuple);

        assertFalse(registry.deregister(Protocol.UDP, tuple));
        assertTrue(registry.deregister(Protocol.TCP, tuple));
        assertFalse(registry.deregister(Protocol.TCP, tuple));
        assertFalse(registry.isRegistered(Protocol.TCP, tuple));
    }

    @Test
    void portsInUseIsScopedToTheAddressAndSorted() {
        registry.register(Protocol.TCP, Endpoint.of("10.0.0.1", 7002));
        registry.register(Protocol.TCP, Endpoint.of("10.0.0.1", 7000));
        registry.register(Protocol.TCP, Endpoint.of("10.0.0.2", 7001));

        assertEquals(List.of(7000, 7002), new ArrayList<>(registry.portsInUse(Protocol.TCP, "10.0.0.1")));
        assertEquals(List.of(7001), new ArrayList<>(registry.portsInUse(Protocol.TCP, "10.0.0.2")));
    }

    @Test
    void concurrentRegistrationOfOneTupleAdmitsExactlyOneWinner() throws InterruptedException {
        Endpoint tuple = Endpoint.of("10.0.0.1", 7000);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            Protocol protocol = i % 2 == 0 ? Protocol.TCP : Protocol.UDP;
            new Thread(() -> {
                try {
                    start.await();
                    registry.register(protocol, tuple);
                    winners.incrementAndGet();
                } catch (DuplicateBindingException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
        assertEquals(threads - 1, conflicts.get());
    }
}
