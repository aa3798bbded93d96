package com.questrail.hostlink.protocol;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.protocol.codec.EnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.EnvelopeEncoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.hostlink.protocol.config.MessageBusConfig;
import com.questrail.hostlink.protocol.internal.bus.EnvelopePublisher;
import com.questrail.hostlink.protocol.internal.bus.ReplyDemultiplexer;
import com.questrail.hostlink.protocol.internal.bus.ReplySlots;
import com.questrail.hostlink.protocol.internal.decode.BusMessageDecoder;
import com.questrail.hostlink.protocol.internal.encode.BusMessageEncoder;
import com.questrail.hostlink.protocol.internal.slot.CallbackSlot;
import com.questrail.hostlink.protocol.internal.time.Cancellable;
import com.questrail.hostlink.protocol.internal.time.MonotonicClock;
import com.questrail.hostlink.protocol.internal.time.MonotonicScheduler;
import com.questrail.hostlink.protocol.internal.time.SystemMonotonicClock;
import com.questrail.hostlink.protocol.model.ClearRecords;
import com.questrail.hostlink.protocol.model.Discriminant;
import com.questrail.hostlink.protocol.model.FetchRecords;
import com.questrail.hostlink.protocol.model.OperationKind;
import com.questrail.hostlink.protocol.model.RemoveRecord;
import com.questrail.hostlink.protocol.model.VerifyActivation;
import com.questrail.hostlink.protocol.observability.BusErrorEvent;
import com.questrail.hostlink.protocol.observability.BusObservabilitySink;
import com.questrail.hostlink.protocol.observability.RequestTimeoutEvent;
import com.questrail.hostlink.protocol.transport.BroadcastTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * MessageBus
 * =============================================================================
 * Management-side endpoint of the host link.
 *
 * <p>Each {@link HostLink} operation arms the callback slot of its kind and
 * publishes one request on the request channel. Replies arrive on the reply
 * channel through a single {@link ReplyDemultiplexer}, which exists once per
 * bus and is subscribed between {@link #register} and {@link #unregister}.</p>
 *
 * <h2>Ownership</h2>
 * The bus borrows its transport. Starting and stopping the transport is the
 * job of whoever built it (see
 * {@link com.questrail.hostlink.protocol.runtime.MessageBusRuntime}).
 *
 * <h2>Reply timeout</h2>
 * When {@link MessageBusConfig#replyTimeout()} is set, every fetch, remove
 * and clear request schedules a deadline. If the same request is still
 * pending at the deadline its callback is released without being invoked and
 * a {@link RequestTimeoutEvent} is reported. The activation callback is a
 * standing status listener and never expires. If the scheduler refuses the
 * deadline (its executor has been shut down), the request is released at once,
 * reported as a {@link BusErrorEvent}, and not sent.
 *
 * <h2>Threading</h2>
 * Requests may be issued from any thread. Callbacks run on the transport's
 * dispatch thread.
 */
public final class MessageBus implements HostLink
{
    private final MessageBusConfig config;
    private final BroadcastTransport transport;
    private final EnvelopeDecoder envelopeDecoder;
    private final BusObservabilitySink sink;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private final ReplySlots slots = new ReplySlots();
    private final EnvelopePublisher publisher;
    private final Map<CallbackSlot<?>, Deadline> deadlines = new ConcurrentHashMap<>();

    // Guarded by this.
    private ReplyDemultiplexer receiver;
    private Object owner;

    /**
     * Bus with the default codec and no reply timeout support.
     *
     * @throws IllegalArgumentException if {@code config} asks for a reply timeout
     */
    public MessageBus(MessageBusConfig config, BroadcastTransport transport, BusObservabilitySink sink) {
        this(config, transport, new DefaultEnvelopeEncoder(), new DefaultEnvelopeDecoder(),
                sink, null, SystemMonotonicClock.INSTANCE);
    }

    /**
     * @param scheduler deadline scheduler; may be null only if {@code config}
     *                  has no reply timeout
     * @param clock     clock the scheduler's deadlines are measured on
     */
    public MessageBus(MessageBusConfig config,
                      BroadcastTransport transport,
                      EnvelopeEncoder envelopeEncoder,
                      EnvelopeDecoder envelopeDecoder,
                      BusObservabilitySink sink,
                      MonotonicScheduler scheduler,
                      MonotonicClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.envelopeDecoder = Objects.requireNonNull(envelopeDecoder, "envelopeDecoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = scheduler;

        if (config.replyTimeoutValue().isPresent() && scheduler == null) {
            throw new IllegalArgumentException("replyTimeout is configured but no scheduler was supplied");
        }

        this.publisher = new EnvelopePublisher(
                transport,
                config.channels().requests(),
                new BusMessageEncoder(),
                Objects.requireNonNull(envelopeEncoder, "envelopeEncoder"));
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    @Override
    public synchronized boolean register(Object owner) {
        Objects.requireNonNull(owner, "owner");

        if (this.owner != null) {
            reportError("Reply receiver already registered to " + describe(this.owner), null);
            return false;
        }

        if (receiver == null) {
            receiver = new ReplyDemultiplexer(
                    config.channels().replies(),
                    config.activationToken(),
                    envelopeDecoder,
                    new BusMessageDecoder(),
                    slots,
                    sink);
        }

        try {
            transport.subscribe(config.channels().replies(), receiver);
        } catch (IllegalStateException e) {
            reportError("Reply receiver subscription refused", e);
            return false;
        }

        this.owner = owner;
        return true;
    }

    @Override
    public synchronized boolean unregister(Object owner) {
        Objects.requireNonNull(owner, "owner");

        if (this.owner == null) {
            reportError("Reply receiver is not registered", null);
            return false;
        }
        if (this.owner != owner) {
            reportError("Reply receiver is registered to " + describe(this.owner)
                    + ", not " + describe(owner), null);
            return false;
        }

        try {
            transport.unsubscribe(receiver);
        } catch (IllegalArgumentException e) {
            reportError("Reply receiver was not subscribed", e);
        }

        this.owner = null;
        cancelDeadlines();
        slots.clearAllSlots();
        return true;
    }

    public synchronized boolean isRegistered() {
        return owner != null;
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    @Override
    public void checkActivation(Consumer<Boolean> callback) {
        slots.activation().arm(Objects.requireNonNull(callback, "callback"));
        publisher.publish(new VerifyActivation());
    }

    @Override
    public void fetchList(Consumer<List<ErrorRecord>> callback) {
        long generation = slots.fetchList().arm(Objects.requireNonNull(callback, "callback"));
        if (scheduleDeadline(slots.fetchList(), generation)) {
            publisher.publish(new FetchRecords());
        }
    }

    @Override
    public void removeOne(ErrorRecord record, Runnable callback) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(callback, "callback");

        long generation = slots.removeOne().arm(ignored -> callback.run());
        if (scheduleDeadline(slots.removeOne(), generation)) {
            publisher.publish(new RemoveRecord(record));
        }
    }

    @Override
    public void clearAll(Runnable callback) {
        Objects.requireNonNull(callback, "callback");

        long generation = slots.clearAll().arm(ignored -> callback.run());
        if (scheduleDeadline(slots.clearAll(), generation)) {
            publisher.publish(new ClearRecords());
        }
    }

    /**
     * Publish an arbitrary discriminant with an optional payload on the request
     * channel, without arming any callback.
     *
     * @throws IllegalArgumentException if {@code value} is not an allowed payload type
     */
    public void publish(Discriminant discriminant, String payloadKey, Object value) {
        publisher.publish(discriminant, payloadKey, value);
    }

    /**
     * @return {@code true} if a callback of {@code kind} is waiting for a reply
     */
    public boolean isPending(OperationKind kind) {
        return slots.slot(Objects.requireNonNull(kind, "kind")).isPending();
    }

    public MessageBusConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /**
     * Schedule the deadline of the request armed as {@code generation}.
     *
     * <p>Requests of one kind may be armed from several threads at once, so the
     * order in which their deadlines get stored is not the order in which they
     * were armed. The stored deadline is always the one of the highest
     * generation; whichever of the two handles loses is cancelled.</p>
     *
     * @return {@code false} if the scheduler refused the deadline, in which case
     *         the request has been released and must not be sent
     */
    private boolean scheduleDeadline(CallbackSlot<?> slot, long generation) {
        if (config.replyTimeoutValue().isEmpty()) {
            return true;
        }
        Duration timeout = config.replyTimeoutValue().get();

        Cancellable handle;
        try {
            handle = scheduler.scheduleAfter(timeout, clock, () -> {
                if (slot.expire(generation)) {
                    sink.onRequestTimeout(new RequestTimeoutEvent(Instant.now(), slot.name(), timeout));
                }
            });
        } catch (RejectedExecutionException e) {
            slot.expire(generation);
            reportError("Reply deadline rejected for " + slot.name() + "; request not sent", e);
            return false;
        }

        deadlines.merge(slot, new Deadline(generation, handle), (current, candidate) -> {
            if (candidate.generation() > current.generation()) {
                current.handle().cancel();
                return candidate;
            }
            candidate.handle().cancel();
            return current;
        });
        return true;
    }

    private void cancelDeadlines() {
        for (CallbackSlot<?> slot : List.copyOf(deadlines.keySet())) {
            Deadline deadline = deadlines.remove(slot);
            if (deadline != null) {
                deadline.handle().cancel();
            }
        }
    }

    private void reportError(String message, Throwable cause) {
        sink.onError(new BusErrorEvent(Instant.now(), message, cause));
    }

    private static String describe(Object owner) {
        return owner.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(owner));
    }

    private record Deadline(long generation, Cancellable handle) {}
}
