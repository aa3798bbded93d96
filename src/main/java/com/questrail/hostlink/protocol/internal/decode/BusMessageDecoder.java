package com.questrail.hostlink.protocol.internal.decode;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.ClearRecords;
import com.questrail.hostlink.protocol.model.Discriminant;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.FetchRecords;
import com.questrail.hostlink.protocol.model.Payload;
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
import java.util.Optional;

/**
 * BusMessageDecoder
 * ============================================================================
 * Converts a decoded {@link Envelope} into a semantic {@link BusMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the inbound boundary between envelope mechanics (discriminant
 * strings, payload keys, payload shapes) and the typed message union the bus
 * and the host responder work with. The mapping is exhaustive over
 * {@link Discriminant}.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Unknown or blank discriminant: {@link Optional#empty()}. A newer peer
 *       may send tags this build does not know; they are not errors.</li>
 *   <li>Replies never fail. An activation reply without a readable text token
 *       carries a null token; a fetch-list reply without a readable record
 *       sequence becomes {@link RecordsReply#degradedEmpty()}.</li>
 *   <li>Requests that cannot be acted on throw {@link EnvelopeDecodeException}.</li>
 * </ul>
 */
public final class BusMessageDecoder
{
    /**
     * @param envelope decoded envelope
     * @return the semantic message, or empty for an unknown discriminant
     *
     * @throws EnvelopeDecodeException if a request envelope has an unusable payload
     */
    public Optional<BusMessage> decode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        Optional<Discriminant> discriminant = Discriminant.fromWire(envelope.discriminant());
        if (discriminant.isEmpty()) {
            return Optional.empty();
        }

        BusMessage message = switch (discriminant.get()) {

            // =============================================================
            // Requests (management application -> host)
            // =============================================================

            case VERIFY_ACTIVATION -> new VerifyActivation();
            case FETCH_LIST -> new FetchRecords();
            case REMOVE_ONE -> decodeRemoveRecord(envelope);
            case CLEAR_ALL -> new ClearRecords();

            // =============================================================
            // Replies (host -> management application)
            // =============================================================

            case ACTIVATION_REPLY -> decodeActivationReply(envelope);
            case FETCH_LIST_REPLY -> decodeRecordsReply(envelope);
            case REMOVE_ONE_REPLY -> new RemoveAck();
            case CLEAR_ALL_REPLY -> new ClearAck();
        };
        return Optional.of(message);
    }

    private RemoveRecord decodeRemoveRecord(Envelope envelope) {
        Payload payload = envelope.payloadFor(PayloadKeys.RECORD)
                .orElseThrow(() -> new EnvelopeDecodeException(
                        "Remove request carries no '" + PayloadKeys.RECORD + "' payload"));

        if (payload instanceof RecordPayload p && p.value() instanceof ErrorRecord record) {
            return new RemoveRecord(record);
        }
        throw new EnvelopeDecodeException(
                "Remove request payload is not an error record: " + payload.getClass().getSimpleName());
    }

    private ActivationReply decodeActivationReply(Envelope envelope) {
        Optional<Payload> payload = envelope.payloadFor(PayloadKeys.ACTIVATION_TOKEN);
        if (payload.isPresent() && payload.get() instanceof TextPayload p) {
            return new ActivationReply(p.value());
        }
        return new ActivationReply(null);
    }

    private RecordsReply decodeRecordsReply(Envelope envelope) {
        Optional<Payload> payload = envelope.payloadFor(PayloadKeys.RECORDS);
        if (payload.isEmpty() || !(payload.get() instanceof RecordSequencePayload p)) {
            return RecordsReply.degradedEmpty();
        }

        List<ErrorRecord> records = new ArrayList<>(p.values().size());
        for (Serializable value : p.values()) {
            if (!(value instanceof ErrorRecord record)) {
                // One foreign element poisons the whole list.
                return RecordsReply.degradedEmpty();
            }
            records.add(record);
        }
        return RecordsReply.of(records);
    }
}
