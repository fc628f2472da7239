package com.questrail.sandnet.observability;

/**
 * No-op implementation of ListenerErrorDelegate.
 */
public final class NullListenerErrorDelegate implements ListenerErrorDelegate {
    public static final NullListenerErrorDelegate INSTANCE = new NullListenerErrorDelegate();

    private NullListenerErrorDelegate() {}

    @Override
    public void onError(ListenerErrorEvent event) {}
}
