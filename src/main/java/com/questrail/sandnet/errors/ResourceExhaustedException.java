package com.questrail.sandnet.errors;

/**
 * No local port candidate remains, either because none was ever available or
 * because every candidate was consumed by conflict rotation.
 */
public final class ResourceExhaustedException extends SandnetException
{
    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
