package com.questrail.hostlink.protocol.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of serializable records. Order is preserved end to end.
 */
public record RecordSequencePayload(List<Serializable> values) implements Payload
{
    public RecordSequencePayload {
        Objects.requireNonNull(values, "values");
        values = List.copyOf(values);
    }
}
