package com.questrail.hostlink.protocol.internal.decode;

/**
 * Indicates that a structurally valid envelope could not be translated into a
 * semantic {@link com.questrail.hostlink.protocol.model.BusMessage}.
 *
 * <p>Raised only for requests: a request with a missing or wrongly shaped
 * payload cannot be acted on. Replies degrade to documented defaults instead.</p>
 */
public final class EnvelopeDecodeException extends RuntimeException
{
    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
