package com.questrail.hostlink.protocol.model;

import java.util.Objects;

/**
 * String payload.
 */
public record TextPayload(String value) implements Payload
{
    public TextPayload {
        Objects.requireNonNull(value, "value");
    }
}
