package com.questrail.hostlink.protocol.codec;

import com.questrail.hostlink.protocol.model.Envelope;

/**
 * EnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for envelopes.
 *
 * <p>This is the outbound boundary between a structured {@link Envelope} and the
 * body bytes handed to a broadcast transport. It applies only the mechanical
 * wire rules (header, field layout, payload value serialization, checksum). It
 * does not decide what to send.</p>
 */
public interface EnvelopeEncoder
{
    /**
     * Encode an envelope into a body suitable for a single broadcast.
     *
     * @throws IllegalArgumentException if the payload cannot be put on the wire
     *         (an undecodable marker, or a record that fails serialization)
     */
    byte[] encode(Envelope envelope);
}
