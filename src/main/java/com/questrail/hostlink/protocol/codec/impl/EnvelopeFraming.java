package com.questrail.hostlink.protocol.codec.impl;

import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * EnvelopeFraming
 * -----------------------------------------------------------------------------
 * Header and checksum rules for an envelope body.
 *
 * <pre>
 *   +------+------+---------+------------------------+-----------+
 *   | 0x48 | 0x4C | version |  fields (see encoder)  |  CRC32 BE |
 *   +------+------+---------+------------------------+-----------+
 * </pre>
 *
 * <p>The CRC covers every byte before it, header included.</p>
 */
final class EnvelopeFraming
{
    static final byte MAGIC_0 = 0x48;
    static final byte MAGIC_1 = 0x4C;
    static final byte VERSION = 1;

    static final int HEADER_LENGTH = 3;
    static final int CRC_LENGTH = 4;

    private EnvelopeFraming() {}

    static void writeHeader(DataOutput out) throws IOException
    {
        out.writeByte(MAGIC_0);
        out.writeByte(MAGIC_1);
        out.writeByte(VERSION);
    }

    /**
     * Append the checksum of {@code body} and return the framed array.
     */
    static byte[] appendCrc(byte[] body)
    {
        byte[] framed = Arrays.copyOf(body, body.length + CRC_LENGTH);
        int crc = (int) crc(body, body.length);
        framed[body.length] = (byte) (crc >>> 24);
        framed[body.length + 1] = (byte) (crc >>> 16);
        framed[body.length + 2] = (byte) (crc >>> 8);
        framed[body.length + 3] = (byte) crc;
        return framed;
    }

    /**
     * Validate header and checksum, returning the field bytes between them.
     *
     * @throws FramingException on short input, foreign magic, unsupported
     *         version or checksum mismatch
     */
    static byte[] extractFields(byte[] framed)
            throws FramingException
    {
        if (framed == null || framed.length < HEADER_LENGTH + CRC_LENGTH) {
            throw new FramingException("Envelope body too short");
        }
        if (framed[0] != MAGIC_0 || framed[1] != MAGIC_1) {
            throw new FramingException("Not an envelope body (bad magic)");
        }
        if (framed[2] != VERSION) {
            throw new FramingException("Unsupported envelope version: " + framed[2]);
        }

        final int crcOffset = framed.length - CRC_LENGTH;
        final long transmitted = ((framed[crcOffset] & 0xFFL) << 24)
                | ((framed[crcOffset + 1] & 0xFFL) << 16)
                | ((framed[crcOffset + 2] & 0xFFL) << 8)
                | (framed[crcOffset + 3] & 0xFFL);
        final long computed = crc(framed, crcOffset);
        if (transmitted != computed) {
            throw new FramingException("Envelope checksum mismatch");
        }

        return Arrays.copyOfRange(framed, HEADER_LENGTH, crcOffset);
    }

    private static long crc(byte[] bytes, int length)
    {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, length);
        return crc.getValue();
    }
}
