package com.questrail.sandnet.errors;

/**
 * Generic failure reported by the underlying transport. Never reinterpreted.
 */
public class TransportException extends SandnetException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
