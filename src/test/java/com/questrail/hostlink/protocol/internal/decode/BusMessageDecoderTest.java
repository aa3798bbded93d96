package com.questrail.hostlink.protocol.internal.decode;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.api.ErrorRecordFixtures;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.ClearRecords;
import com.questrail.hostlink.protocol.model.Discriminant;
import com.questrail.hostlink.protocol.model.Envelope;
import com.questrail.hostlink.protocol.model.FetchRecords;
import com.questrail.hostlink.protocol.model.IntPayload;
import com.questrail.hostlink.protocol.model.PayloadKeys;
import com.questrail.hostlink.protocol.model.RecordPayload;
import com.questrail.hostlink.protocol.model.RecordSequencePayload;
import com.questrail.hostlink.protocol.model.RecordsReply;
import com.questrail.hostlink.protocol.model.RemoveAck;
import com.questrail.hostlink.protocol.model.RemoveRecord;
import com.questrail.hostlink.protocol.model.TextPayload;
import com.questrail.hostlink.protocol.model.UndecodablePayload;
import com.questrail.hostlink.protocol.model.VerifyActivation;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BusMessageDecoderTest {

    private final BusMessageDecoder decoder = new BusMessageDecoder();

    @Test
    void decodesPayloadlessRequestsAndAcks() {
        assertInstanceOf(VerifyActivation.class, decode(Envelope.of(Discriminant.VERIFY_ACTIVATION)));
        assertInstanceOf(FetchRecords.class, decode(Envelope.of(Discriminant.FETCH_LIST)));
        assertInstanceOf(ClearRecords.class, decode(Envelope.of(Discriminant.CLEAR_ALL)));
        assertInstanceOf(RemoveAck.class, decode(Envelope.of(Discriminant.REMOVE_ONE_REPLY)));
        assertInstanceOf(ClearAck.class, decode(Envelope.of(Discriminant.CLEAR_ALL_REPLY)));
    }

    @Test
    void unknownDiscriminantIsEmpty() {
        assertTrue(decoder.decode(new Envelope("restart-request", null, null)).isEmpty());
        assertTrue(decoder.decode(new Envelope("", null, null)).isEmpty());
    }

    @Test
    void removeRequestCarriesTheRecord() {
        ErrorRecord record = ErrorRecordFixtures.record("com.example", 3L);

        BusMessage message = decode(Envelope.of(Discriminant.REMOVE_ONE, PayloadKeys.RECORD, new RecordPayload(record)));

        assertEquals(record, assertInstanceOf(RemoveRecord.class, message).record());
    }

    @Test
    void removeRequestWithoutUsableRecordThrows() {
        assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode(Envelope.of(Discriminant.REMOVE_ONE)));
        assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode(Envelope.of(Discriminant.REMOVE_ONE, PayloadKeys.RECORD, new IntPayload(1))));
        assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode(Envelope.of(Discriminant.REMOVE_ONE, PayloadKeys.RECORD, new RecordPayload("text"))));
    }

    @Test
    void activationReplyTokenIsReadOnlyFromText() {
        ActivationReply good = (ActivationReply) decode(
                Envelope.of(Discriminant.ACTIVATION_REPLY, PayloadKeys.ACTIVATION_TOKEN, new TextPayload("v1")));
        assertTrue(good.matches("v1"));
        assertFalse(good.matches("v2"));

        ActivationReply wrongType = (ActivationReply) decode(
                Envelope.of(Discriminant.ACTIVATION_REPLY, PayloadKeys.ACTIVATION_TOKEN, new IntPayload(1)));
        assertTrue(wrongType.tokenValue().isEmpty());
        assertFalse(wrongType.matches("1"));

        ActivationReply missing = (ActivationReply) decode(Envelope.of(Discriminant.ACTIVATION_REPLY));
        assertTrue(missing.tokenValue().isEmpty());
    }

    @Test
    void recordsReplyKeepsHostOrder() {
        ErrorRecord a = ErrorRecordFixtures.record("com.a", 1L);
        ErrorRecord b = ErrorRecordFixtures.record("com.b", 2L);

        RecordsReply reply = (RecordsReply) decode(Envelope.of(Discriminant.FETCH_LIST_REPLY, PayloadKeys.RECORDS,
                new RecordSequencePayload(List.<Serializable>of(b, a))));

        assertFalse(reply.degraded());
        assertEquals(List.of(b, a), reply.records());
    }

    @Test
    void recordsReplyDegradesToEmptyOnUnusablePayload() {
        RecordsReply missing = (RecordsReply) decode(Envelope.of(Discriminant.FETCH_LIST_REPLY));
        RecordsReply undecodable = (RecordsReply) decode(Envelope.of(Discriminant.FETCH_LIST_REPLY, PayloadKeys.RECORDS,
                new UndecodablePayload((byte) 'L', "filter rejected")));
        RecordsReply foreign = (RecordsReply) decode(Envelope.of(Discriminant.FETCH_LIST_REPLY, PayloadKeys.RECORDS,
                new RecordSequencePayload(List.<Serializable>of(ErrorRecordFixtures.record("com.a", 1L), "stray"))));
        RecordsReply wrongKey = (RecordsReply) decode(Envelope.of(Discriminant.FETCH_LIST_REPLY, "items",
                new RecordSequencePayload(List.<Serializable>of(ErrorRecordFixtures.record("com.a", 1L)))));

        for (RecordsReply reply : List.of(missing, undecodable, foreign, wrongKey)) {
            assertTrue(reply.degraded());
            assertTrue(reply.records().isEmpty());
        }
    }

    private BusMessage decode(Envelope envelope) {
        return decoder.decode(envelope).orElseThrow();
    }
}
