package com.questrail.sandnet.errors;

/**
 * The transport reports that a prior binding of the requested local tuple has
 * not finished being torn down. Transient: callers may back off and retry.
 */
public final class CleanupInProgressException extends SandnetException
{
    public CleanupInProgressException(String message) {
        super(message);
    }
}
