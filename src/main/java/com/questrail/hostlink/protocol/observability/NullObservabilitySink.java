package com.questrail.hostlink.protocol.observability;

/**
 * No-op implementation of BusObservabilitySink.
 */
public final class NullObservabilitySink implements BusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(BusTransportEvent event) {}

    @Override
    public void onEnvelopeDropped(EnvelopeDroppedEvent event) {}

    @Override
    public void onRequestTimeout(RequestTimeoutEvent event) {}

    @Override
    public void onError(BusErrorEvent event) {}
}
