package com.questrail.sandnet.errors;

/**
 * A bounded wait expired before the requested amount of work completed.
 */
public final class OperationTimeoutException extends SandnetException
{
    public OperationTimeoutException(String message) {
        super(message);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
