package com.questrail.hostlink.protocol.model;

/**
 * Asks the host to drop every record.
 *
 * <p>Valid reply: {@link ClearAck}.</p>
 */
public record ClearRecords() implements BusRequest
{
    @Override
    public Discriminant discriminant() {
        return Discriminant.CLEAR_ALL;
    }
}
