package com.questrail.sandnet.observability;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.api.Protocol;

import java.time.Instant;

/**
 * Record of a contained listener failure: a callback that threw, a dispatch
 * the worker pool rejected, or an accept/receive error that tore the
 * listener down.
 *
 * @param diagnostic human-readable text starting with the protocol tag and
 *                   tuple, followed by the stack trace of {@code cause}
 */
public record ListenerErrorEvent(
    Instant timestamp,
    Protocol protocol,
    Endpoint tuple,
    String diagnostic,
    Throwable cause
) {
}
