package com.questrail.sandnet.errors;

/**
 * A non-blocking primitive had no data or capacity available right now.
 *
 * <p>Only surfaced to callers of a socket whose timeout is zero. Everywhere
 * else it is absorbed by a polling loop.</p>
 */
public final class WouldBlockException extends SandnetException
{
    public WouldBlockException(String message) {
        super(message);
    }
}
