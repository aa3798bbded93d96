package com.questrail.hostlink.protocol.codec;

import com.questrail.hostlink.protocol.model.Envelope;

import java.util.Optional;

/**
 * EnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for envelopes.
 *
 * <p>The decoder is invoked with exactly one broadcast body and treats it as a
 * complete unit. It is responsible for:</p>
 * <ul>
 *   <li>Validating the header, version and checksum</li>
 *   <li>Detecting truncation</li>
 *   <li>Reconstructing the payload value</li>
 * </ul>
 *
 * <p>It does not interpret discriminants. A body that fails structural checks
 * is reported as {@link Optional#empty()}; a body whose payload value alone
 * cannot be reconstructed still decodes, with an
 * {@link com.questrail.hostlink.protocol.model.UndecodablePayload}, so the
 * routing layer can degrade it.</p>
 */
public interface EnvelopeDecoder
{
    /**
     * @param body raw bytes of one broadcast
     * @return the envelope, or empty if the body is malformed
     */
    Optional<Envelope> decode(byte[] body);
}
