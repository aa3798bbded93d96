package com.questrail.hostlink.protocol.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * A request's callback was released because no reply came within the timeout.
 *
 * @param slot name of the callback slot that expired
 */
public record RequestTimeoutEvent(
    Instant timestamp,
    String slot,
    Duration timeout
) {
}
