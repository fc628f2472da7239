package com.questrail.sandnet.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default ListenerErrorDelegate: logs every contained failure via SLF4J.
 */
public final class Slf4jListenerErrorDelegate implements ListenerErrorDelegate {
    private static final Logger log = LoggerFactory.getLogger(Slf4jListenerErrorDelegate.class);

    public static final Slf4jListenerErrorDelegate INSTANCE = new Slf4jListenerErrorDelegate();

    private Slf4jListenerErrorDelegate() {}

    @Override
    public void onError(ListenerErrorEvent event) {
        log.error("{} listener on {} failed: {}",
            event.protocol().tag(),
            event.tuple(),
            event.cause() != null ? event.cause().toString() : event.diagnostic(),
            event.cause());
    }
}
