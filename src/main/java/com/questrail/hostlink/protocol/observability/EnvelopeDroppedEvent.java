package com.questrail.hostlink.protocol.observability;

import java.time.Instant;

/**
 * Record of an inbound envelope that reached no callback.
 *
 * @param discriminant the raw discriminant, or null if the body did not decode
 */
public record EnvelopeDroppedEvent(
    Instant timestamp,
    Reason reason,
    String discriminant
) {
    public enum Reason {
        /** Body failed framing or checksum validation. */
        MALFORMED,
        /** Discriminant field was blank. */
        BLANK_DISCRIMINANT,
        /** Discriminant is not one this build knows. */
        UNKNOWN_DISCRIMINANT,
        /** A request envelope arrived on the reply channel, or a payload was unusable. */
        UNEXPECTED,
        /** Reply arrived while no callback of its kind was pending. */
        NO_PENDING_CALLBACK,
        /** Fetch reply payload was unusable; the callback received an empty list. */
        DEGRADED
    }
}
