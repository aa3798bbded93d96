package com.questrail.hostlink.protocol.model;

/**
 * Acknowledges a {@link RemoveRecord}. Carries no payload.
 */
public record RemoveAck() implements BusReply
{
    @Override
    public Discriminant discriminant() {
        return Discriminant.REMOVE_ONE_REPLY;
    }
}
