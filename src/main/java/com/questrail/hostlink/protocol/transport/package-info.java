/**
 * Broadcast transport port.
 * =============================================================================
 *
 * <p>These types are the framework-agnostic boundary between a concrete
 * broadcast medium (Netty UDP, an in-process hub, a test double) and the
 * message bus. Everything above this package sees only channel names and raw
 * envelope bodies as {@code byte[]}.</p>
 *
 * <p>Implementations MUST:</p>
 * <ul>
 *   <li>Perform transport I/O and channel filtering only</li>
 *   <li>Not decode envelopes or interpret discriminants</li>
 *   <li>Not retry, acknowledge or time out</li>
 * </ul>
 */
package com.questrail.hostlink.protocol.transport;
