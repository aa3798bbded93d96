package com.questrail.hostlink.protocol.runtime;

import com.questrail.hostlink.protocol.MessageBus;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.hostlink.protocol.config.MessageBusConfig;
import com.questrail.hostlink.protocol.host.ErrorRecordStore;
import com.questrail.hostlink.protocol.host.HostRequestHandler;
import com.questrail.hostlink.protocol.internal.time.MonotonicClock;
import com.questrail.hostlink.protocol.internal.time.MonotonicScheduler;
import com.questrail.hostlink.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.hostlink.protocol.internal.time.SystemMonotonicClock;
import com.questrail.hostlink.protocol.observability.BusObservabilitySink;
import com.questrail.hostlink.protocol.observability.NullObservabilitySink;
import com.questrail.hostlink.protocol.transport.BroadcastTransport;
import com.questrail.hostlink.protocol.transport.udp.netty.NettyUdpBroadcastTransport;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MessageBusRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a host link endpoint.
 *
 * <p>Owns the transport and the deadline executor; the {@link MessageBus} and
 * the optional {@link HostRequestHandler} borrow them. By default the
 * transport is a {@link NettyUdpBroadcastTransport} bound to
 * {@link #DEFAULT_PORT} on all interfaces and sending to the limited
 * broadcast address on the same port.</p>
 */
public final class MessageBusRuntime {
    public static final int DEFAULT_PORT = 47820;

    private final BroadcastTransport transport;
    private final MessageBus bus;
    private final HostRequestHandler hostHandler;
    private final ScheduledExecutorService schedulerExecutor;

    private MessageBusRuntime(
            BroadcastTransport transport,
            MessageBus bus,
            HostRequestHandler hostHandler,
            ScheduledExecutorService schedulerExecutor) {
        this.transport = transport;
        this.bus = bus;
        this.hostHandler = hostHandler;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        if (hostHandler != null) {
            hostHandler.start();
        }
        transport.start();
    }

    public void stop() {
        if (hostHandler != null) {
            hostHandler.stop();
        }
        transport.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public MessageBus bus() {
        return bus;
    }

    public Optional<HostRequestHandler> hostHandler() {
        return Optional.ofNullable(hostHandler);
    }

    public BroadcastTransport transport() {
        return transport;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageBusConfig config = MessageBusConfig.defaults();
        private BusObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private InetSocketAddress broadcastAddress = new InetSocketAddress("255.255.255.255", DEFAULT_PORT);
        private BroadcastTransport transport;
        private ErrorRecordStore hostStore;

        public Builder withConfig(MessageBusConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(BusObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        public Builder withBroadcastAddress(InetSocketAddress address) {
            this.broadcastAddress = address;
            return this;
        }

        /**
         * Use {@code transport} instead of building a Netty UDP transport.
         * Bind and broadcast addresses are then ignored.
         */
        public Builder withTransport(BroadcastTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Also answer requests on this endpoint, out of {@code store}.
         */
        public Builder withHostResponder(ErrorRecordStore store) {
            this.hostStore = store;
            return this;
        }

        public MessageBusRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "hostlink-reply-deadlines");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Transport
            BroadcastTransport busTransport = transport != null
                    ? transport
                    : new NettyUdpBroadcastTransport(
                            Objects.requireNonNull(bindAddress, "bindAddress"),
                            Objects.requireNonNull(broadcastAddress, "broadcastAddress"));

            // 3. Endpoints
            MessageBus bus = new MessageBus(
                    config,
                    busTransport,
                    new DefaultEnvelopeEncoder(),
                    new DefaultEnvelopeDecoder(),
                    observabilitySink,
                    scheduler,
                    clock);

            HostRequestHandler handler = hostStore == null
                    ? null
                    : new HostRequestHandler(config, busTransport, hostStore, observabilitySink);

            return new MessageBusRuntime(busTransport, bus, handler, schedulerExec);
        }
    }
}
