package com.questrail.sandnet.config;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Aggregated configuration for a sandnet runtime.
 *
 * <p>{@code connectPorts} are the local TCP ports outbound connections may be
 * bound to; {@code messagePorts} the local UDP ports outbound datagrams may be
 * sent from. Listeners may bind any port; while bound, their port is removed
 * from the matching candidate set.</p>
 */
public record SandnetConfig(
    SortedSet<Integer> connectPorts,
    SortedSet<Integer> messagePorts,
    SandnetTimingPolicy timing,
    int receiveChunkSize,
    int maxConcurrentEvents
) {
    public static final int DEFAULT_RECEIVE_CHUNK_SIZE = 4096;
    public static final int DEFAULT_MAX_CONCURRENT_EVENTS = 32;

    public SandnetConfig {
        Objects.requireNonNull(connectPorts, "connectPorts");
        Objects.requireNonNull(messagePorts, "messagePorts");
        Objects.requireNonNull(timing, "timing");

        connectPorts = Collections.unmodifiableSortedSet(new TreeSet<>(connectPorts));
        messagePorts = Collections.unmodifiableSortedSet(new TreeSet<>(messagePorts));

        if (connectPorts.isEmpty() || messagePorts.isEmpty()) {
            throw new IllegalArgumentException("at least one connect port and one message port required");
        }
        checkPorts(connectPorts);
        checkPorts(messagePorts);
        if (receiveChunkSize <= 0) {
            throw new IllegalArgumentException("receiveChunkSize must be positive");
        }
        if (maxConcurrentEvents <= 0) {
            throw new IllegalArgumentException("maxConcurrentEvents must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void checkPorts(SortedSet<Integer> ports) {
        if (ports.first() < 1 || ports.last() > 65535) {
            throw new IllegalArgumentException("ports must be 1-65535");
        }
    }

    public static final class Builder {
        private final SortedSet<Integer> connectPorts = new TreeSet<>();
        private final SortedSet<Integer> messagePorts = new TreeSet<>();
        private SandnetTimingPolicy timing = SandnetTimingPolicy.defaults();
        private int receiveChunkSize = DEFAULT_RECEIVE_CHUNK_SIZE;
        private int maxConcurrentEvents = DEFAULT_MAX_CONCURRENT_EVENTS;

        public Builder allowConnectPort(int port) {
            connectPorts.add(port);
            return this;
        }

        public Builder allowConnectPorts(int first, int last) {
            addRange(connectPorts, first, last);
            return this;
        }

        public Builder allowMessagePort(int port) {
            messagePorts.add(port);
            return this;
        }

        public Builder allowMessagePorts(int first, int last) {
            addRange(messagePorts, first, last);
            return this;
        }

        public Builder withTiming(SandnetTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public Builder withReceiveChunkSize(int receiveChunkSize) {
            this.receiveChunkSize = receiveChunkSize;
            return this;
        }

        public Builder withMaxConcurrentEvents(int maxConcurrentEvents) {
            this.maxConcurrentEvents = maxConcurrentEvents;
            return this;
        }

        public SandnetConfig build() {
            return new SandnetConfig(connectPorts, messagePorts, timing, receiveChunkSize, maxConcurrentEvents);
        }

        private static void addRange(SortedSet<Integer> target, int first, int last) {
            if (first > last) {
                throw new IllegalArgumentException("empty port range " + first + "-" + last);
            }
            for (int p = first; p <= last; p++) {
                target.add(p);
            }
        }
    }
}
