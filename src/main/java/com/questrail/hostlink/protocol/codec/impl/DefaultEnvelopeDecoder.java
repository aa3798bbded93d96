package com.questrail.hostlink.protocol.codec.impl;

import com.questrail.hostlink.protocol.codec.EnvelopeDecoder;
import com.questrail.hostlink.protocol.model.BoolPayload;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.IntPayload;
import com.questrail.hostlink.protocol.model.Payload;
import com.questrail.hostlink.protocol.model.RecordPayload;
import com.questrail.hostlink.protocol.model.RecordSequencePayload;
import com.questrail.hostlink.protocol.model.TextPayload;
import com.questrail.hostlink.protocol.model.UndecodablePayload;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DefaultEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Concrete {@link EnvelopeDecoder}, the inverse of {@link DefaultEnvelopeEncoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header and checksum validation ({@link EnvelopeFraming})</li>
 *   <li>Field parsing (discriminant, payload flag, key, type tag)</li>
 *   <li>Payload value reconstruction</li>
 * </ol>
 *
 * <p>Failures in steps 1 and 2, and length fields that overrun the body, drop
 * the body. A failure in step 3 for record values (filter rejection, unknown
 * class, corrupt object stream) and an unknown type tag keep the envelope and
 * substitute an {@link UndecodablePayload}.</p>
 */
public final class DefaultEnvelopeDecoder implements EnvelopeDecoder
{
    private final RecordSerialization serialization;

    public DefaultEnvelopeDecoder()
    {
        this(RecordSerialization.DEFAULT_FILTER_PATTERN);
    }

    /**
     * @param filterPattern {@link java.io.ObjectInputFilter} pattern applied to record values
     */
    public DefaultEnvelopeDecoder(String filterPattern)
    {
        this.serialization = new RecordSerialization(filterPattern);
    }

    @Override
    public Optional<Envelope> decode(byte[] body)
    {
        try {
            final byte[] fields = EnvelopeFraming.extractFields(body);
            final DataInputStream in = new DataInputStream(new ByteArrayInputStream(fields));

            final String discriminant = in.readUTF();
            final int flag = in.readUnsignedByte();

            if (flag == 0) {
                requireExhausted(in);
                return Optional.of(new Envelope(discriminant, null, null));
            }
            if (flag != 1) {
                throw new FramingException("Invalid payload flag: " + flag);
            }

            final String key = in.readUTF();
            if (key.isBlank()) {
                throw new FramingException("Blank payload key");
            }
            final byte tag = in.readByte();
            final Payload payload = readPayload(in, tag);
            if (!(payload instanceof UndecodablePayload)) {
                requireExhausted(in);
            }
            return Optional.of(new Envelope(discriminant, key, payload));
        }
        catch (FramingException | IOException e) {
            // Structural failure -> drop body
            return Optional.empty();
        }
    }

    private Payload readPayload(DataInputStream in, byte tag) throws IOException, FramingException
    {
        switch (tag) {
            case PayloadTags.TEXT:
                return new TextPayload(new String(readSized(in), StandardCharsets.UTF_8));
            case PayloadTags.INT:
                return new IntPayload(in.readInt());
            case PayloadTags.BOOL:
                return new BoolPayload(in.readBoolean());
            case PayloadTags.RECORD: {
                byte[] raw = readSized(in);
                try {
                    return new RecordPayload(serialization.read(raw));
                }
                catch (IOException | ClassNotFoundException | RuntimeException e) {
                    return new UndecodablePayload(tag, describe(e));
                }
            }
            case PayloadTags.RECORD_SEQUENCE: {
                int count = in.readInt();
                if (count < 0 || count > in.available()) {
                    throw new FramingException("Invalid record count: " + count);
                }
                List<byte[]> raw = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    raw.add(readSized(in));
                }
                List<Serializable> values = new ArrayList<>(count);
                try {
                    for (byte[] element : raw) {
                        values.add(serialization.read(element));
                    }
                }
                catch (IOException | ClassNotFoundException | RuntimeException e) {
                    return new UndecodablePayload(tag, describe(e));
                }
                return new RecordSequencePayload(values);
            }
            default:
                return new UndecodablePayload(tag, "Unknown payload type tag: " + (char) tag);
        }
    }

    private static byte[] readSized(DataInputStream in) throws IOException, FramingException
    {
        int length = in.readInt();
        if (length < 0 || length > in.available()) {
            throw new FramingException("Length field overruns body: " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    private static void requireExhausted(DataInputStream in) throws IOException, FramingException
    {
        if (in.available() > 0) {
            throw new FramingException("Trailing bytes after envelope fields");
        }
    }

    private static String describe(Exception e)
    {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
