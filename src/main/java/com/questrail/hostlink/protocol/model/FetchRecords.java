package com.questrail.hostlink.protocol.model;

/**
 * Asks the host for every captured error record.
 *
 * <p>Valid reply: {@link RecordsReply}.</p>
 */
public record FetchRecords() implements BusRequest
{
    @Override
    public Discriminant discriminant() {
        return Discriminant.FETCH_LIST;
    }
}
