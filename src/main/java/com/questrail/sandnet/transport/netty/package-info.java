/**
 * Netty-backed {@link com.questrail.sandnet.transport.RawTransport}.
 *
 * <p>Netty channel and buffer types do not leave this package. Inbound data is copied out of
 * {@code ByteBuf}s into queues owned by each handle.</p>
 */
package com.questrail.sandnet.transport.netty;
