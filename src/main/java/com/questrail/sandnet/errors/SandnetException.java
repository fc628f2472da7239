package com.questrail.sandnet.errors;

/**
 * Root of the unchecked error taxonomy raised by the sandnet layer.
 *
 * <p>Argument errors are not part of this hierarchy; they surface as
 * {@link IllegalArgumentException} or {@link NullPointerException} and are
 * never retried.</p>
 */
public abstract class SandnetException extends RuntimeException
{
    protected SandnetException(String message) {
        super(message);
    }

    protected SandnetException(String message, Throwable cause) {
        super(message, cause);
    }
}
