package com.questrail.hostlink.protocol.internal.bus;

import com.questrail.hostlink.protocol.codec.EnvelopeEncoder;
import com.questrail.hostlink.protocol.internal.encode.BusMessageEncoder;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.Discriminant;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.Payload;
import com.questrail.hostlink.protocol.transport.BroadcastTransport;

import java.util.Objects;

/**
 * EnvelopePublisher
 * =============================================================================
 * Outbound half of the bus: builds an envelope and hands it to the transport.
 *
 * <pre>
 *   BusMessage
 *        → BusMessageEncoder
 *            → Envelope
 *                → EnvelopeEncoder
 *                    → BroadcastTransport.send(channel, ...)
 * </pre>
 *
 * <p>Publishing is fire-and-forget. This class holds no mutable state and
 * takes no locks, so it may be called from any thread. Nothing about delivery
 * is observable here.</p>
 */
public final class EnvelopePublisher
{
    private final BroadcastTransport transport;
    private final String channel;
    private final BusMessageEncoder messageEncoder;
    private final EnvelopeEncoder envelopeEncoder;

    public EnvelopePublisher(BroadcastTransport transport,
                             String channel,
                             BusMessageEncoder messageEncoder,
                             EnvelopeEncoder envelopeEncoder) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
        this.envelopeEncoder = Objects.requireNonNull(envelopeEncoder, "envelopeEncoder");
    }

    /**
     * Publish a semantic message.
     */
    public void publish(BusMessage message) {
        Objects.requireNonNull(message, "message");
        publish(messageEncoder.encode(message));
    }

    /**
     * Publish a discriminant with an optional untyped payload.
     *
     * @param payloadKey payload slot name, or null for no payload
     * @param value      payload value; ignored when {@code payloadKey} is null
     *
     * @throws IllegalArgumentException if {@code value} is not an allowed payload type
     */
    public void publish(Discriminant discriminant, String payloadKey, Object value) {
        Objects.requireNonNull(discriminant, "discriminant");

        Envelope envelope = (payloadKey == null || payloadKey.isBlank())
                ? Envelope.of(discriminant)
                : Envelope.of(discriminant, payloadKey, Payload.of(value));
        publish(envelope);
    }

    /**
     * Publish a prepared envelope.
     */
    public void publish(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        transport.send(channel, envelopeEncoder.encode(envelope));
    }

    public String channel() {
        return channel;
    }
}
