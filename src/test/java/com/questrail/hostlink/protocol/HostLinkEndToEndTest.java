package com.questrail.hostlink.protocol;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.api.ErrorRecordFixtures;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.protocol.config.MessageBusConfig;
import com.questrail.hostlink.protocol.host.ErrorRecordStore;
import com.questrail.hostlink.protocol.host.HostRequestHandler;
import com.questrail.hostlink.protocol.model.OperationKind;
import com.questrail.hostlink.protocol.observability.RecordingObservabilitySink;
import com.questrail.hostlink.protocol.transport.local.LocalBroadcastHub;
import com.questrail.hostlink.protocol.transport.local.LocalBroadcastTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HostLinkEndToEndTest
 * -----------------------------------------------------------------------------
 * Management-side {@link MessageBus} and host-side {@link HostRequestHandler}
 * on separate transports of one {@link LocalBroadcastHub}, the way the two
 * processes share one broadcast medium.
 */
class HostLinkEndToEndTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ErrorRecordStore store = new ErrorRecordStore();
    private LocalBroadcastHub hub;

    @AfterEach
    void tearDown() {
        if (hub != null) {
            hub.close();
        }
    }

    @Test
    void fullConversationOverSynchronousHub() {
        hub = new LocalBroadcastHub(Runnable::run);
        HostLink link = wire(MessageBusConfig.defaults());

        ErrorRecord a = ErrorRecordFixtures.record("com.a", 1L);
        ErrorRecord b = ErrorRecordFixtures.nativeCrash("com.b", 2L);
        store.add(a);
        store.add(b);

        List<Boolean> activation = new ArrayList<>();
        link.checkActivation(activation::add);
        assertEquals(List.of(true), activation);

        List<List<ErrorRecord>> fetched = new ArrayList<>();
        link.fetchList(fetched::add);
        assertEquals(List.of(List.of(a, b)), fetched);

        AtomicBoolean removed = new AtomicBoolean();
        link.removeOne(a, () -> removed.set(true));
        assertTrue(removed.get());
        assertEquals(List.of(b), store.snapshot());

        AtomicBoolean cleared = new AtomicBoolean();
        link.clearAll(() -> cleared.set(true));
        assertTrue(cleared.get());
        assertTrue(store.snapshot().isEmpty());

        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void mismatchedTokenReportsInactive() {
        hub = new LocalBroadcastHub(Runnable::run);

        LocalBroadcastTransport hostTransport = hub.newTransport();
        HostRequestHandler handler = new HostRequestHandler(
                MessageBusConfig.builder().withActivationToken("older-module").build(),
                hostTransport, store, sink);
        handler.start();
        hostTransport.start();

        LocalBroadcastTransport moduleTransport = hub.newTransport();
        MessageBus bus = new MessageBus(MessageBusConfig.defaults(), moduleTransport, sink);
        bus.register(this);
        moduleTransport.start();

        List<Boolean> activation = new ArrayList<>();
        bus.checkActivation(activation::add);
        handler.pushActivationStatus();

        assertEquals(List.of(false, false), activation);
    }

    @Test
    void noHostListeningMeansNoCallback() {
        hub = new LocalBroadcastHub(Runnable::run);
        LocalBroadcastTransport moduleTransport = hub.newTransport();
        MessageBus bus = new MessageBus(MessageBusConfig.defaults(), moduleTransport, sink);
        bus.register(this);
        moduleTransport.start();

        AtomicBoolean called = new AtomicBoolean();
        bus.fetchList(records -> called.set(true));

        assertFalse(called.get());
        assertTrue(bus.isPending(OperationKind.FETCH_LIST));
    }

    @Test
    void repliesArriveOnDispatchThread() throws InterruptedException {
        hub = new LocalBroadcastHub();
        HostLink link = wire(MessageBusConfig.defaults());
        store.add(ErrorRecordFixtures.record("com.a", 1L));

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> thread = new AtomicReference<>();
        AtomicReference<List<ErrorRecord>> records = new AtomicReference<>();

        link.fetchList(list -> {
            thread.set(Thread.currentThread().getName());
            records.set(list);
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Fetch reply should arrive");
        assertEquals("hostlink-local-broadcast", thread.get());
        assertEquals(1, records.get().size());
    }

    private HostLink wire(MessageBusConfig config) {
        LocalBroadcastTransport hostTransport = hub.newTransport();
        new HostRequestHandler(config, hostTransport, store, sink).start();
        hostTransport.start();

        LocalBroadcastTransport moduleTransport = hub.newTransport();
        MessageBus bus = new MessageBus(config, moduleTransport, sink);
        assertTrue(bus.register(this));
        moduleTransport.start();
        return bus;
    }
}
