package com.questrail.hostlink.protocol.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single serializable record.
 */
public record RecordPayload(Serializable value) implements Payload
{
    public RecordPayload {
        Objects.requireNonNull(value, "value");
    }
}
