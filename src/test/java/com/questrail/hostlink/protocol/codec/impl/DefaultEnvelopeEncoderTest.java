package com.questrail.hostlink.protocol.codec.impl;

import com.questrail.hostlink.protocol.model.Discriminant;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.TextPayload;
import com.questrail.hostlink.protocol.model.UndecodablePayload;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultEnvelopeEncoderTest
 * -----------------------------------------------------------------------------
 * Byte layout checks for {@link DefaultEnvelopeEncoder}.
 */
final class DefaultEnvelopeEncoderTest
{
    private final DefaultEnvelopeEncoder encoder = new DefaultEnvelopeEncoder();

    @Test
    void writesHeaderDiscriminantAndEmptyPayloadFlag() throws Exception
    {
        byte[] body = encoder.encode(Envelope.of(Discriminant.VERIFY_ACTIVATION));

        assertEquals(0x48, body[0]);
        assertEquals(0x4C, body[1]);
        assertEquals(1, body[2]);

        byte[] fields = EnvelopeFraming.extractFields(body);
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(fields));
        assertEquals("activation-request", in.readUTF());
        assertEquals(0, in.readUnsignedByte());
        assertEquals(0, in.available());
    }

    @Test
    void writesKeyTagAndTextValue() throws Exception
    {
        byte[] body = encoder.encode(
                Envelope.of(Discriminant.ACTIVATION_REPLY, "activation-token", new TextPayload("abc")));

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(EnvelopeFraming.extractFields(body)));
        assertEquals("activation-reply", in.readUTF());
        assertEquals(1, in.readUnsignedByte());
        assertEquals("activation-token", in.readUTF());
        assertEquals('S', in.readByte());
        assertEquals(3, in.readInt());
        byte[] value = new byte[3];
        in.readFully(value);
        assertArrayEquals("abc".getBytes(), value);
    }

    @Test
    void encodingIsDeterministic()
    {
        Envelope envelope = Envelope.of(Discriminant.ACTIVATION_REPLY, "activation-token", new TextPayload("x"));

        assertTrue(Arrays.equals(encoder.encode(envelope), encoder.encode(envelope)));
    }

    @Test
    void refusesToPublishUndecodablePayload()
    {
        Envelope envelope = new Envelope("fetch-list-reply", "records", new UndecodablePayload((byte) 'L', "bad"));

        assertThrows(IllegalArgumentException.class, () -> encoder.encode(envelope));
    }

    @Test
    void checksumMismatchIsReportedAsFramingFailure()
    {
        byte[] body = encoder.encode(Envelope.of(Discriminant.CLEAR_ALL_REPLY));
        body[body.length - 5] ^= 0x01;

        assertThrows(FramingException.class, () -> EnvelopeFraming.extractFields(body));
    }
}
