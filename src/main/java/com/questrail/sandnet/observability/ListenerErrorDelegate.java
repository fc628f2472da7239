package com.questrail.sandnet.observability;

/**
 * Receives listener failures that were contained instead of propagated.
 *
 * <p>Implementations may log, count or forward. Anything an implementation
 * throws is discarded by the caller.</p>
 */
public interface ListenerErrorDelegate {
    /**
     * @param event the contained failure
     */
    void onError(ListenerErrorEvent event);
}
