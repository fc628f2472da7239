package com.questrail.sandnet.errors;

/**
 * The local tuple is held by someone else on the underlying transport.
 */
public final class AlreadyInUseException extends PortConflictException
{
    public AlreadyInUseException(String message) {
        super(message);
    }

    public AlreadyInUseException(String message, Throwable cause) {
        super(message, cause);
    }
}
