package com.questrail.hostlink.protocol.observability;

/**
 * Receives diagnostic events from the message bus and the host responder.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Nothing reported here is surfaced to the bus's callers; every event
 * describes a condition the bus already absorbed.</p>
 */
public interface BusObservabilitySink {
    /**
     * Transport came up or went down.
     */
    void onTransportEvent(BusTransportEvent event);

    /**
     * An inbound envelope was not routed to any callback.
     */
    void onEnvelopeDropped(EnvelopeDroppedEvent event);

    /**
     * A pending request was released by its reply timeout.
     */
    void onRequestTimeout(RequestTimeoutEvent event);

    /**
     * A fault was isolated: a throwing callback, a failed publish, a
     * registration call in the wrong state.
     */
    void onError(BusErrorEvent event);
}
