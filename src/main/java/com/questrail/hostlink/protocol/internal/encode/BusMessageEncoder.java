package com.questrail.hostlink.protocol.internal.encode;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.ClearRecords;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.FetchRecords;
import com.questrail.hostlink.protocol.model.PayloadKeys;
import com.questrail.hostlink.protocol.model.RecordPayload;
import com.questrail.hostlink.protocol.model.RecordSequencePayload;
import com.questrail.hostlink.protocol.model.RecordsReply;
import com.questrail.hostlink.protocol.model.RemoveAck;
import com.questrail.hostlink.protocol.model.RemoveRecord;
import com.questrail.hostlink.protocol.model.TextPayload;
import com.questrail.hostlink.protocol.model.VerifyActivation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BusMessageEncoder
 * ============================================================================
 * Converts a semantic {@link BusMessage} into an {@link Envelope}.
 *
 * <p>Selects the discriminant and, for the messages that carry one, the payload
 * key and payload shape. The shapes are fixed per discriminant:</p>
 * <ul>
 *   <li>{@code remove-one-request}: {@link RecordPayload} under {@link PayloadKeys#RECORD}</li>
 *   <li>{@code activation-reply}: {@link TextPayload} under {@link PayloadKeys#ACTIVATION_TOKEN}</li>
 *   <li>{@code fetch-list-reply}: {@link RecordSequencePayload} under {@link PayloadKeys#RECORDS}</li>
 *   <li>everything else: no payload</li>
 * </ul>
 */
public final class BusMessageEncoder
{
    public Envelope encode(BusMessage message) {
        Objects.requireNonNull(message, "message");

        if (message instanceof VerifyActivation
                || message instanceof FetchRecords
                || message instanceof ClearRecords
                || message instanceof RemoveAck
                || message instanceof ClearAck) {
            return Envelope.of(message.discriminant());
        }
        else if (message instanceof RemoveRecord m) {
            return Envelope.of(m.discriminant(), PayloadKeys.RECORD, new RecordPayload(m.record()));
        }
        else if (message instanceof ActivationReply m) {
            if (m.token() == null) {
                return Envelope.of(m.discriminant());
            }
            return Envelope.of(m.discriminant(), PayloadKeys.ACTIVATION_TOKEN, new TextPayload(m.token()));
        }
        else if (message instanceof RecordsReply m) {
            List<Serializable> values = new ArrayList<>(m.records().size());
            for (ErrorRecord record : m.records()) {
                values.add(record);
            }
            return Envelope.of(m.discriminant(), PayloadKeys.RECORDS, new RecordSequencePayload(values));
        }

        // Sealed hierarchy makes this unreachable.
        throw new IllegalArgumentException("Unsupported message type: " + message.getClass());
    }
}
