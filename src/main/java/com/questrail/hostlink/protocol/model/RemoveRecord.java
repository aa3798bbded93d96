package com.questrail.hostlink.protocol.model;

import com.questrail.hostlink.api.ErrorRecord;

import java.util.Objects;

/**
 * Asks the host to drop one record. The host matches on {@link ErrorRecord#identity()}.
 *
 * <p>Valid reply: {@link RemoveAck}.</p>
 */
public record RemoveRecord(ErrorRecord record) implements BusRequest
{
    public RemoveRecord {
        Objects.requireNonNull(record, "record");
    }

    @Override
    public Discriminant discriminant() {
        return Discriminant.REMOVE_ONE;
    }
}
