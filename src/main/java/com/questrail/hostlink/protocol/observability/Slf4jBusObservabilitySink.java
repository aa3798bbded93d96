package com.questrail.hostlink.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BusObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBusObservabilitySink implements BusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBusObservabilitySink.class);

    @Override
    public void onTransportEvent(BusTransportEvent event) {
        if (event.cause() != null) {
            log.info("Host link transport {}", event.kind(), event.cause());
        } else {
            log.info("Host link transport {}", event.kind());
        }
    }

    @Override
    public void onEnvelopeDropped(EnvelopeDroppedEvent event) {
        log.debug("Envelope dropped ({}): {}", event.reason(), event.discriminant());
    }

    @Override
    public void onRequestTimeout(RequestTimeoutEvent event) {
        log.warn("No reply for {} within {}, callback released", event.slot(), event.timeout());
    }

    @Override
    public void onError(BusErrorEvent event) {
        log.error("Host link error: {}", event.message(), event.cause());
    }
}
