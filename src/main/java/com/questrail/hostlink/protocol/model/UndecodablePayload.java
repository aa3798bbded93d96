package com.questrail.hostlink.protocol.model;

import java.util.Objects;

/**
 * Inbound-only marker for a payload whose value could not be reconstructed.
 *
 * <p>The envelope around it was intact (framing and checksum passed), so the
 * discriminant can still be routed. Semantic decoding degrades it to the
 * documented default for that discriminant.</p>
 *
 * @param typeTag wire type tag that was announced
 * @param reason  human-readable failure description
 */
public record UndecodablePayload(byte typeTag, String reason) implements Payload
{
    public UndecodablePayload {
        Objects.requireNonNull(reason, "reason");
    }
}
