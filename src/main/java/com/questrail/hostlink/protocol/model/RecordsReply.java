package com.questrail.hostlink.protocol.model;

import com.questrail.hostlink.api.ErrorRecord;

import java.util.List;
import java.util.Objects;

/**
 * Captured error records from the host, in host order.
 *
 * @param records  the records; empty when the payload could not be decoded
 * @param degraded {@code true} if the payload was missing or undecodable and
 *                 {@code records} is the empty default rather than real data
 */
public record RecordsReply(List<ErrorRecord> records, boolean degraded) implements BusReply
{
    public RecordsReply {
        Objects.requireNonNull(records, "records");
        records = List.copyOf(records);
    }

    public static RecordsReply of(List<ErrorRecord> records) {
        return new RecordsReply(records, false);
    }

    public static RecordsReply degradedEmpty() {
        return new RecordsReply(List.of(), true);
    }

    @Override
    public Discriminant discriminant() {
        return Discriminant.FETCH_LIST_REPLY;
    }
}
