package com.questrail.hostlink.protocol.host;

import com.questrail.hostlink.protocol.codec.EnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.EnvelopeEncoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.hostlink.protocol.config.MessageBusConfig;
import com.questrail.hostlink.protocol.internal.bus.EnvelopePublisher;
import com.questrail.hostlink.protocol.internal.decode.BusMessageDecoder;
import com.questrail.hostlink.protocol.internal.decode.EnvelopeDecodeException;
import com.questrail.hostlink.protocol.internal.encode.BusMessageEncoder;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.BusRequest;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.ClearRecords;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.FetchRecords;
import com.questrail.hostlink.protocol.model.RecordsReply;
import com.questrail.hostlink.protocol.model.RemoveAck;
import com.questrail.hostlink.protocol.model.RemoveRecord;
import com.questrail.hostlink.protocol.model.VerifyActivation;
import com.questrail.hostlink.protocol.observability.BusErrorEvent;
import com.questrail.hostlink.protocol.observability.BusObservabilitySink;
import com.questrail.hostlink.protocol.observability.BusTransportEvent;
import com.questrail.hostlink.protocol.observability.EnvelopeDroppedEvent;
import com.questrail.hostlink.protocol.transport.BroadcastListener;
import com.questrail.hostlink.protocol.transport.BroadcastTransport;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * HostRequestHandler
 * =============================================================================
 * Host-module side of the link: answers requests from the management
 * application out of an {@link ErrorRecordStore}.
 *
 * <pre>
 *   activation-request  → activation-reply (configured token)
 *   fetch-list-request  → fetch-list-reply (store snapshot)
 *   remove-one-request  → remove from store → remove-one-reply
 *   clear-all-request   → clear store       → clear-all-reply
 * </pre>
 *
 * <p>Remove is acknowledged whether or not the record was found; the
 * requester only learns that the host processed the request.</p>
 *
 * <p>The handler listens on the request channel and publishes on the reply
 * channel. Like the bus it borrows its transport.</p>
 */
public final class HostRequestHandler implements BroadcastListener
{
    private final MessageBusConfig config;
    private final BroadcastTransport transport;
    private final ErrorRecordStore store;
    private final EnvelopeDecoder envelopeDecoder;
    private final BusMessageDecoder messageDecoder = new BusMessageDecoder();
    private final EnvelopePublisher publisher;
    private final BusObservabilitySink sink;

    private boolean started;

    public HostRequestHandler(MessageBusConfig config,
                              BroadcastTransport transport,
                              ErrorRecordStore store,
                              BusObservabilitySink sink) {
        this(config, transport, store, new DefaultEnvelopeEncoder(), new DefaultEnvelopeDecoder(), sink);
    }

    public HostRequestHandler(MessageBusConfig config,
                              BroadcastTransport transport,
                              ErrorRecordStore store,
                              EnvelopeEncoder envelopeEncoder,
                              EnvelopeDecoder envelopeDecoder,
                              BusObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.store = Objects.requireNonNull(store, "store");
        this.envelopeDecoder = Objects.requireNonNull(envelopeDecoder, "envelopeDecoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.publisher = new EnvelopePublisher(
                transport,
                config.channels().replies(),
                new BusMessageEncoder(),
                Objects.requireNonNull(envelopeEncoder, "envelopeEncoder"));
    }

    /**
     * Subscribe to the request channel. Calling twice is a no-op.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        transport.subscribe(config.channels().requests(), this);
        started = true;
    }

    /**
     * Unsubscribe from the request channel. Calling when not started is a no-op.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        transport.unsubscribe(this);
    }

    /**
     * Broadcast the current activation status without being asked.
     */
    public void pushActivationStatus() {
        publisher.publish(new ActivationReply(config.activationToken()));
    }

    public ErrorRecordStore store() {
        return store;
    }

    @Override
    public void onBroadcast(String channel, byte[] body) {
        if (!config.channels().requests().equals(channel)) {
            return;
        }

        Optional<Envelope> envelope = envelopeDecoder.decode(body);
        if (envelope.isEmpty()) {
            dropped(EnvelopeDroppedEvent.Reason.MALFORMED, null);
            return;
        }

        String discriminant = envelope.get().discriminant();
        Optional<BusMessage> message;
        try {
            message = messageDecoder.decode(envelope.get());
        } catch (EnvelopeDecodeException e) {
            dropped(EnvelopeDroppedEvent.Reason.UNEXPECTED, discriminant);
            return;
        }

        if (message.isEmpty()) {
            dropped(EnvelopeDroppedEvent.Reason.UNKNOWN_DISCRIMINANT, discriminant);
            return;
        }
        if (!(message.get() instanceof BusRequest request)) {
            dropped(EnvelopeDroppedEvent.Reason.UNEXPECTED, discriminant);
            return;
        }

        try {
            publisher.publish(answer(request));
        } catch (RuntimeException e) {
            sink.onError(new BusErrorEvent(Instant.now(), "Failed to answer " + discriminant, e));
        }
    }

    private BusMessage answer(BusRequest request) {
        if (request instanceof VerifyActivation) {
            return new ActivationReply(config.activationToken());
        }
        else if (request instanceof FetchRecords) {
            return RecordsReply.of(store.snapshot());
        }
        else if (request instanceof RemoveRecord remove) {
            store.remove(remove.record());
            return new RemoveAck();
        }
        else if (request instanceof ClearRecords) {
            store.clear();
            return new ClearAck();
        }
        throw new IllegalStateException("Unhandled request type: " + request.getClass().getName());
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
