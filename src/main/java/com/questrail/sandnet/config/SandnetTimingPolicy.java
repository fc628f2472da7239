package com.questrail.sandnet.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SandnetTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for connects, sockets and listeners.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: deadline for an outbound connect when the
 *       caller does not give one.</li>
 *   <li><b>cleanupThreshold</b>: once the transport has reported that a
 *       local tuple is still being torn down, a connect loop with this much
 *       time or less remaining gives up instead of issuing another attempt
 *       with a near-zero timeout.</li>
 *   <li><b>cleanupBackoff</b>: pause before retrying a tuple that is still
 *       being torn down.</li>
 *   <li><b>socketPollInterval</b>: initial poll interval of every new
 *       {@code SandboxSocket}.</li>
 *   <li><b>listenerPollInterval</b>: default accept/receive poll period for
 *       listeners.</li>
 * </ul>
 */
public record SandnetTimingPolicy(
        Duration connectTimeout,
        Duration cleanupThreshold,
        Duration cleanupBackoff,
        Duration socketPollInterval,
        Duration listenerPollInterval
) {
    public SandnetTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(cleanupThreshold, "cleanupThreshold");
        Objects.requireNonNull(cleanupBackoff, "cleanupBackoff");
        Objects.requireNonNull(socketPollInterval, "socketPollInterval");
        Objects.requireNonNull(listenerPollInterval, "listenerPollInterval");

        requirePositive(connectTimeout, "connectTimeout");
        if (cleanupThreshold.isNegative()) {
            throw new IllegalArgumentException("cleanupThreshold must be non-negative");
        }
        if (cleanupBackoff.isNegative()) {
            throw new IllegalArgumentException("cleanupBackoff must be non-negative");
        }
        requirePositive(socketPollInterval, "socketPollInterval");
        requirePositive(listenerPollInterval, "listenerPollInterval");
    }

    /**
     * Default values:
     * <ul>
     *   <li>connectTimeout: 60s</li>
     *   <li>cleanupThreshold: 100ms</li>
     *   <li>cleanupBackoff: 200ms</li>
     *   <li>socketPollInterval: 100ms</li>
     *   <li>listenerPollInterval: 100ms</li>
     * </ul>
     */
    public static SandnetTimingPolicy defaults() {
        return new SandnetTimingPolicy(
                Duration.ofSeconds(60),
                Duration.ofMillis(100),
                Duration.ofMillis(200),
                Duration.ofMillis(100),
                Duration.ofMillis(100)
        );
    }

    public SandnetTimingPolicy withConnectTimeout(Duration connectTimeout) {
        return new SandnetTimingPolicy(connectTimeout, cleanupThreshold, cleanupBackoff,
                socketPollInterval, listenerPollInterval);
    }

    public SandnetTimingPolicy withCleanup(Duration threshold, Duration backoff) {
        return new SandnetTimingPolicy(connectTimeout, threshold, backoff,
                socketPollInterval, listenerPollInterval);
    }

    public SandnetTimingPolicy withPollIntervals(Duration socketPoll, Duration listenerPoll) {
        return new SandnetTimingPolicy(connectTimeout, cleanupThreshold, cleanupBackoff,
                socketPoll, listenerPoll);
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
