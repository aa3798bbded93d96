package com.questrail.hostlink.protocol.codec.impl;

/**
 * Structural defect in an envelope body. Never leaves the codec: the decoder
 * converts it into an empty result.
 */
final class FramingException extends Exception
{
    FramingException(String message) {
        super(message);
    }

    FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
