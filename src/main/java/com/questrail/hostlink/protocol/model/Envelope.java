package com.questrail.hostlink.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Envelope
 * =============================================================================
 * Unit exchanged over the broadcast transport.
 *
 * <p>An envelope carries a mandatory discriminant string and at most one named
 * payload. The discriminant is kept as a raw string so that envelopes from a
 * newer peer (unknown discriminants) survive decoding and can be ignored at the
 * routing layer.</p>
 *
 * @param discriminant operation or reply tag; never null, may be blank on
 *                     malformed inbound traffic
 * @param payloadKey   payload slot name, or null when there is no payload
 * @param payload      payload value, or null when there is no payload
 */
public record Envelope(String discriminant, String payloadKey, Payload payload)
{
    public Envelope {
        Objects.requireNonNull(discriminant, "discriminant");
        if ((payloadKey == null) != (payload == null)) {
            throw new IllegalArgumentException("payloadKey and payload must be both present or both absent");
        }
        if (payloadKey != null && payloadKey.isBlank()) {
            throw new IllegalArgumentException("payloadKey must not be blank");
        }
    }

    public static Envelope of(Discriminant discriminant) {
        return new Envelope(discriminant.wire(), null, null);
    }

    public static Envelope of(Discriminant discriminant, String payloadKey, Payload payload) {
        return new Envelope(discriminant.wire(),
                Objects.requireNonNull(payloadKey, "payloadKey"),
                Objects.requireNonNull(payload, "payload"));
    }

    public boolean hasPayload() {
        return payload != null;
    }

    /**
     * @return the payload if it is stored under {@code key}, otherwise empty
     */
    public Optional<Payload> payloadFor(String key) {
        if (payload == null || !payloadKey.equals(key)) {
            return Optional.empty();
        }
        return Optional.of(payload);
    }
}
