package com.questrail.hostlink.protocol.codec.impl;

import com.questrail.hostlink.protocol.codec.EnvelopeEncoder;
import com.questrail.hostlink.protocol.model.BoolPayload;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.IntPayload;
import com.questrail.hostlink.protocol.model.Payload;
import com.questrail.hostlink.protocol.model.RecordPayload;
import com.questrail.hostlink.protocol.model.RecordSequencePayload;
import com.questrail.hostlink.protocol.model.TextPayload;
import com.questrail.hostlink.protocol.model.UndecodablePayload;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultEnvelopeEncoder
 * -----------------------------------------------------------------------------
 * Concrete {@link EnvelopeEncoder}.
 *
 * <p>Field layout between header and checksum:</p>
 * <pre>
 *   u16 length + UTF-8   discriminant
 *   u8                   payload flag (0 = none, 1 = present)
 *   -- when present --
 *   u16 length + UTF-8   payload key
 *   u8                   type tag (S, I, Z, R, L)
 *   value                S: i32 length + UTF-8
 *                        I: i32
 *                        Z: u8
 *                        R: i32 length + serialized record
 *                        L: i32 count, then count x (i32 length + serialized record)
 * </pre>
 */
public final class DefaultEnvelopeEncoder implements EnvelopeEncoder
{
    private final RecordSerialization serialization;

    public DefaultEnvelopeEncoder()
    {
        this.serialization = new RecordSerialization(RecordSerialization.DEFAULT_FILTER_PATTERN);
    }

    @Override
    public byte[] encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            EnvelopeFraming.writeHeader(out);
            out.writeUTF(envelope.discriminant());

            if (!envelope.hasPayload()) {
                out.writeByte(0);
            }
            else {
                out.writeByte(1);
                out.writeUTF(envelope.payloadKey());
                writePayload(out, envelope.payload());
            }
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not fail; only an oversized UTF field lands here.
            throw new UncheckedIOException("Envelope cannot be encoded", e);
        }

        return EnvelopeFraming.appendCrc(bytes.toByteArray());
    }

    private void writePayload(DataOutputStream out, Payload payload) throws IOException
    {
        if (payload instanceof TextPayload p) {
            out.writeByte(PayloadTags.TEXT);
            byte[] utf8 = p.value().getBytes(StandardCharsets.UTF_8);
            out.writeInt(utf8.length);
            out.write(utf8);
        }
        else if (payload instanceof IntPayload p) {
            out.writeByte(PayloadTags.INT);
            out.writeInt(p.value());
        }
        else if (payload instanceof BoolPayload p) {
            out.writeByte(PayloadTags.BOOL);
            out.writeBoolean(p.value());
        }
        else if (payload instanceof RecordPayload p) {
            out.writeByte(PayloadTags.RECORD);
            writeRecord(out, p.value());
        }
        else if (payload instanceof RecordSequencePayload p) {
            out.writeByte(PayloadTags.RECORD_SEQUENCE);
            out.writeInt(p.values().size());
            for (Serializable value : p.values()) {
                writeRecord(out, value);
            }
        }
        else if (payload instanceof UndecodablePayload p) {
            throw new IllegalArgumentException("Undecodable payload cannot be published: " + p.reason());
        }
        else {
            throw new IllegalArgumentException("Unsupported payload type: " + payload.getClass());
        }
    }

    private void writeRecord(DataOutputStream out, Serializable value) throws IOException
    {
        byte[] serialized = serialization.write(value);
        out.writeInt(serialized.length);
        out.write(serialized);
    }
}
