/**
 * Unchecked error taxonomy.
 *
 * <pre>
 *   SandnetException
 *     ResourceExhaustedException     no local port candidate left
 *     OperationTimeoutException      bounded wait expired
 *     CleanupInProgressException     local tuple still tearing down (transient)
 *     WouldBlockException            non-blocking call had nothing to do
 *     PortConflictException
 *       AlreadyInUseException        held by someone else on the transport
 *       DuplicateBindingException    already bound by this layer
 *     TransportException             anything else the transport reports
 *       ConnectionClosedException
 * </pre>
 */
package com.questrail.sandnet.errors;
