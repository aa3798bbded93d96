package com.questrail.hostlink.protocol.model;

/**
 * 32-bit integer payload.
 */
public record IntPayload(int value) implements Payload
{
}
