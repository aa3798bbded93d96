package com.questrail.hostlink.protocol.model;

/**
 * Acknowledges a {@link ClearRecords}. Carries no payload.
 */
public record ClearAck() implements BusReply
{
    @Override
    public Discriminant discriminant() {
        return Discriminant.CLEAR_ALL_REPLY;
    }
}
