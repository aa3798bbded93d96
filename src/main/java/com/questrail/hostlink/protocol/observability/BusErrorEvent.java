package com.questrail.hostlink.protocol.observability;

import java.time.Instant;

/**
 * Record representing an isolated fault in the message bus.
 */
public record BusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
