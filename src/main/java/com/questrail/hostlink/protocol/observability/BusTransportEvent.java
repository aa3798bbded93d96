package com.questrail.hostlink.protocol.observability;

import java.time.Instant;

/**
 * Transport lifecycle transition.
 *
 * @param cause diagnostic cause of a {@link Kind#DOWN} transition, or null
 */
public record BusTransportEvent(
    Instant timestamp,
    Kind kind,
    Throwable cause
) {
    public enum Kind { UP, DOWN }
}
