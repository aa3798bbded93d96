package com.questrail.hostlink.protocol.codec.impl;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Objects;

/**
 * RecordSerialization
 * -----------------------------------------------------------------------------
 * Java object serialization of record payload values.
 *
 * <p>Inbound bytes come from any process able to broadcast on the channel, so
 * every read runs behind an {@link ObjectInputFilter}. Only the classes named
 * by the filter pattern can be materialized; everything else is rejected
 * before construction.</p>
 */
final class RecordSerialization
{
    /**
     * Default allow-list: the bus's own record types plus the core
     * {@code java.lang} and {@code java.util} value and collection classes.
     */
    static final String DEFAULT_FILTER_PATTERN =
            "maxdepth=16;com.questrail.hostlink.api.*;java.lang.*;java.util.*;!*";

    private final ObjectInputFilter filter;

    RecordSerialization(String filterPattern)
    {
        Objects.requireNonNull(filterPattern, "filterPattern");
        this.filter = ObjectInputFilter.Config.createFilter(filterPattern);
    }

    /**
     * @throws IllegalArgumentException if the value graph is not serializable
     */
    byte[] write(Serializable value)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        catch (IOException e) {
            throw new IllegalArgumentException(
                    "Record payload cannot be serialized: " + value.getClass().getName(), e);
        }
        return bytes.toByteArray();
    }

    /**
     * @throws IOException            on corrupt streams or filter rejection
     * @throws ClassNotFoundException if the stream names an unknown class
     */
    Serializable read(byte[] bytes) throws IOException, ClassNotFoundException
    {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            in.setObjectInputFilter(filter);
            Object value = in.readObject();
            if (!(value instanceof Serializable s)) {
                throw new IOException("Deserialized value is not serializable: "
                        + (value == null ? "null" : value.getClass().getName()));
            }
            return s;
        }
    }
}
