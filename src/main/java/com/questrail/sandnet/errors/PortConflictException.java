package com.questrail.sandnet.errors;

/**
 * Hard conflict on a local tuple. Retried only when the local port was
 * selected automatically.
 */
public abstract class PortConflictException extends SandnetException
{
    protected PortConflictException(String message) {
        super(message);
    }

    protected PortConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
