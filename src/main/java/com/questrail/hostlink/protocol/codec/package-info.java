/**
 * Envelope codec ports.
 * =============================================================================
 *
 * <p>The codec layer sits <strong>below</strong> message semantics and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte[] body
 *        → EnvelopeDecoder        (wire rules applied here)
 *            → Envelope           (discriminant + optional named payload)
 *                → BusMessageDecoder
 *                    → BusMessage → ReplyDemultiplexer
 * </pre>
 *
 * <p>The outbound path is the mirror image: {@code BusMessage → BusMessageEncoder
 * → Envelope → EnvelopeEncoder → byte[]}.</p>
 *
 * <p>All byte-level mechanics live exclusively in {@code codec.impl}.</p>
 */
package com.questrail.hostlink.protocol.codec;
