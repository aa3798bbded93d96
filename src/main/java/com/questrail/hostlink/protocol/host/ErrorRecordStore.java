package com.questrail.hostlink.protocol.host;

import com.questrail.hostlink.api.ErrorRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory, insertion-ordered store of captured error records.
 *
 * <p>Records are matched by {@link ErrorRecord#identity()}. Adding a record
 * whose identity is already stored replaces the stored one in place.</p>
 */
public final class ErrorRecordStore
{
    private final List<ErrorRecord> records = new ArrayList<>();

    public synchronized void add(ErrorRecord record) {
        Objects.requireNonNull(record, "record");

        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).identity().equals(record.identity())) {
                records.set(i, record);
                return;
            }
        }
        records.add(record);
    }

    /**
     * @return an immutable copy of the records in insertion order
     */
    public synchronized List<ErrorRecord> snapshot() {
        return List.copyOf(records);
    }

    /**
     * @return {@code true} if a record with the same identity was removed
     */
    public synchronized boolean remove(ErrorRecord record) {
        Objects.requireNonNull(record, "record");
        ErrorRecord.Identity identity = record.identity();
        return records.removeIf(r -> r.identity().equals(identity));
    }

    public synchronized void clear() {
        records.clear();
    }

    public synchronized int size() {
        return records.size();
    }
}
