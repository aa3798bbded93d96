package com.questrail.hostlink.protocol.internal.bus;

import com.questrail.hostlink.protocol.codec.EnvelopeDecoder;
import com.questrail.hostlink.protocol.internal.decode.BusMessageDecoder;
import com.questrail.hostlink.protocol.internal.decode.EnvelopeDecodeException;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.BusReply;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.RecordsReply;
import com.questrail.hostlink.protocol.model.RemoveAck;
import com.questrail.hostlink.protocol.observability.BusErrorEvent;
import com.questrail.hostlink.protocol.observability.BusObservabilitySink;
import com.questrail.hostlink.protocol.observability.BusTransportEvent;
import com.questrail.hostlink.protocol.observability.EnvelopeDroppedEvent;
import com.questrail.hostlink.protocol.transport.BroadcastListener;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ReplyDemultiplexer
 * =============================================================================
 * Inbound half of the bus: routes each reply broadcast to the callback slot of
 * its operation kind.
 *
 * <pre>
 *   byte[]
 *     → EnvelopeDecoder          (framing, checksum)
 *       → BusMessageDecoder      (discriminant → typed reply)
 *         → ReplySlots           (fire pending callback)
 * </pre>
 *
 * <h2>Failure isolation</h2>
 * Nothing escapes {@link #onBroadcast}. Undecodable bodies, blank or unknown
 * discriminants, requests heard on the reply channel and replies with no
 * pending callback are dropped and reported. A callback that throws is
 * reported as a {@link BusErrorEvent}; the next reply is handled normally.
 *
 * <h2>Threading</h2>
 * Runs on the transport's dispatch context. Callbacks run on that same thread.
 */
public final class ReplyDemultiplexer implements BroadcastListener
{
    private final String replyChannel;
    private final String activationToken;
    private final EnvelopeDecoder envelopeDecoder;
    private final BusMessageDecoder messageDecoder;
    private final ReplySlots slots;
    private final BusObservabilitySink sink;

    public ReplyDemultiplexer(String replyChannel,
                              String activationToken,
                              EnvelopeDecoder envelopeDecoder,
                              BusMessageDecoder messageDecoder,
                              ReplySlots slots,
                              BusObservabilitySink sink) {
        this.replyChannel = Objects.requireNonNull(replyChannel, "replyChannel");
        this.activationToken = Objects.requireNonNull(activationToken, "activationToken");
        this.envelopeDecoder = Objects.requireNonNull(envelopeDecoder, "envelopeDecoder");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onBroadcast(String channel, byte[] body) {
        if (!replyChannel.equals(channel)) {
            return;
        }

        Optional<BusMessage> message;
        String discriminant = null;
        try {
            Optional<Envelope> envelope = envelopeDecoder.decode(body);
            if (envelope.isEmpty()) {
                dropped(EnvelopeDroppedEvent.Reason.MALFORMED, null);
                return;
            }

            discriminant = envelope.get().discriminant();
            if (discriminant == null || discriminant.isBlank()) {
                dropped(EnvelopeDroppedEvent.Reason.BLANK_DISCRIMINANT, discriminant);
                return;
            }

            message = messageDecoder.decode(envelope.get());
        } catch (EnvelopeDecodeException e) {
            dropped(EnvelopeDroppedEvent.Reason.UNEXPECTED, discriminant);
            return;
        } catch (RuntimeException e) {
            sink.onError(new BusErrorEvent(Instant.now(), "Failed to decode reply broadcast", e));
            return;
        }

        if (message.isEmpty()) {
            dropped(EnvelopeDroppedEvent.Reason.UNKNOWN_DISCRIMINANT, discriminant);
            return;
        }

        if (!(message.get() instanceof BusReply reply)) {
            // A request heard on the reply channel: not ours to answer.
            dropped(EnvelopeDroppedEvent.Reason.UNEXPECTED, discriminant);
            return;
        }

        dispatch(reply);
    }

    private void dispatch(BusReply reply) {
        String discriminant = reply.discriminant().wire();

        boolean delivered;
        try {
            if (reply instanceof ActivationReply activation) {
                delivered = slots.activation().fire(activation.matches(activationToken));
            }
            else if (reply instanceof RecordsReply records) {
                if (records.degraded()) {
                    dropped(EnvelopeDroppedEvent.Reason.DEGRADED, discriminant);
                }
                delivered = slots.fetchList().fire(records.records());
            }
            else if (reply instanceof RemoveAck) {
                delivered = slots.removeOne().fire(null);
            }
            else if (reply instanceof ClearAck) {
                delivered = slots.clearAll().fire(null);
            }
            else {
                throw new IllegalStateException("Unhandled reply type: " + reply.getClass().getName());
            }
        } catch (RuntimeException e) {
            sink.onError(new BusErrorEvent(Instant.now(), "Callback for " + discriminant + " failed", e));
            return;
        }

        if (!delivered) {
            dropped(EnvelopeDroppedEvent.Reason.NO_PENDING_CALLBACK, discriminant);
        }
    }

    @Override
    public void onTransportUp() {
        sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.Kind.UP, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.Kind.DOWN, cause));
    }

    private void dropped(EnvelopeDroppedEvent.Reason reason, String discriminant) {
        sink.onEnvelopeDropped(new EnvelopeDroppedEvent(Instant.now(), reason, discriminant));
    }
}
