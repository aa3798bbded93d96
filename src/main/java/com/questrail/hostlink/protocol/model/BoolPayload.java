package com.questrail.hostlink.protocol.model;

/**
 * Boolean payload.
 */
public record BoolPayload(boolean value) implements Payload
{
}
