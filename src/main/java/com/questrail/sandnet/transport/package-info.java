/**
 * Raw Transport Ports
 * =============================================================================
 *
 * These interfaces are the boundary between the sandbox's primitive networking
 * calls and the rest of the layer.
 *
 * <h2>Why these ports exist</h2>
 * The primitives are non-blocking and resource-limited. Everything above this
 * package (timeouts, buffering, port rotation, accept polling) is written
 * against these interfaces only, so it can run over Netty in production and
 * over scripted fakes in tests.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Never block waiting for data, capacity or inbound connections</li>
 *   <li>Signal "nothing to do right now" with {@code WouldBlockException}</li>
 *   <li>Not retry, rotate ports or apply timeouts of their own beyond the
 *       single connect attempt they are given</li>
 *   <li>Not leak framework types (e.g. Netty {@code ByteBuf}) across the port</li>
 * </ul>
 */
package com.questrail.sandnet.transport;
