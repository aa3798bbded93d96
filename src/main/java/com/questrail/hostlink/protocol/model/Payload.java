package com.questrail.hostlink.protocol.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed payload union carried by an {@link Envelope}.
 *
 * <h2>Allowed shapes</h2>
 * <ul>
 *   <li>{@link TextPayload} - a string</li>
 *   <li>{@link IntPayload} - a 32-bit integer</li>
 *   <li>{@link BoolPayload} - a boolean</li>
 *   <li>{@link RecordPayload} - one serializable record</li>
 *   <li>{@link RecordSequencePayload} - an ordered sequence of serializable records</li>
 * </ul>
 *
 * <p>{@link UndecodablePayload} is produced only by the inbound codec, when an
 * envelope is structurally sound but its value cannot be reconstructed. It can
 * never be published.</p>
 *
 * <p>The payload shape of a given discriminant is fixed by the protocol. Code
 * that builds payloads from typed values uses the variant constructors directly;
 * {@link #of(Object)} is the gate for untyped values.</p>
 */
public sealed interface Payload
        permits TextPayload, IntPayload, BoolPayload, RecordPayload,
                RecordSequencePayload, UndecodablePayload
{
    /**
     * Wrap an untyped value in the matching payload variant.
     *
     * <p>Any value outside the allowed shapes is a protocol violation by the
     * calling code and fails immediately.</p>
     *
     * @throws IllegalArgumentException if {@code value} is null, a list holding
     *         non-serializable elements, or of any other non-serializable type
     */
    static Payload of(Object value) {
        if (value instanceof String s) {
            return new TextPayload(s);
        }
        if (value instanceof Integer i) {
            return new IntPayload(i);
        }
        if (value instanceof Boolean b) {
            return new BoolPayload(b);
        }
        if (value instanceof List<?> list) {
            List<Serializable> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                if (!(element instanceof Serializable s)) {
                    throw new IllegalArgumentException(
                            "Payload sequence element is not serializable: "
                                    + (element == null ? "null" : element.getClass().getName()));
                }
                elements.add(s);
            }
            return new RecordSequencePayload(elements);
        }
        if (value instanceof Serializable s) {
            return new RecordPayload(s);
        }
        throw new IllegalArgumentException(
                "Payload type not allowed: " + (value == null ? "null" : value.getClass().getName()));
    }
}
