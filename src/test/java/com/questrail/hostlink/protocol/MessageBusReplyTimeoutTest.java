package com.questrail.hostlink.protocol;

import com.questrail.hostlink.api.ErrorRecordFixtures;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.hostlink.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.hostlink.protocol.config.LinkChannels;
import com.questrail.hostlink.protocol.config.MessageBusConfig;
import com.questrail.hostlink.protocol.internal.encode.BusMessageEncoder;
import com.questrail.hostlink.protocol.internal.time.MonotonicScheduler;
import com.questrail.hostlink.protocol.model.ActivationReply;
import com.questrail.hostlink.protocol.model.BusMessage;
import com.questrail.hostlink.protocol.model.ClearAck;
import com.questrail.hostlink.protocol.model.OperationKind;
import com.questrail.hostlink.protocol.model.RecordsReply;
import com.questrail.hostlink.protocol.model.RemoveAck;
import com.questrail.hostlink.protocol.observability.RecordingObservabilitySink;
import com.questrail.hostlink.protocol.observability.RequestTimeoutEvent;
import com.questrail.hostlink.protocol.time.DeterministicScheduler;
import com.questrail.hostlink.protocol.time.ManualMonotonicClock;
import com.questrail.hostlink.protocol.transport.FakeBroadcastTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reply timeout behavior, driven by a manual clock and a deterministic scheduler.
 */
class MessageBusReplyTimeoutTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeBroadcastTransport transport = new FakeBroadcastTransport();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final Object owner = new Object();

    private MessageBus bus;

    @BeforeEach
    void setUp() {
        bus = newBus(scheduler);
        assertTrue(bus.register(owner));
    }

    @Test
    void pendingRequestIsReleasedAtDeadline() {
        AtomicInteger calls = new AtomicInteger();
        bus.fetchList(records -> calls.incrementAndGet());

        clock.advance(TIMEOUT.minusMillis(1));
        scheduler.runDueTasks();
        assertTrue(bus.isPending(OperationKind.FETCH_LIST));

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertFalse(bus.isPending(OperationKind.FETCH_LIST));

        List<RequestTimeoutEvent> timeouts = sink.getTimeouts();
        assertEquals(1, timeouts.size());
        assertEquals("fetch-list", timeouts.get(0).slot());
        assertEquals(TIMEOUT, timeouts.get(0).timeout());

        reply(RecordsReply.of(List.of()));
        assertEquals(0, calls.get());
    }

    @Test
    void replyBeforeDeadlineIsNotTimedOut() {
        AtomicInteger calls = new AtomicInteger();
        bus.removeOne(ErrorRecordFixtures.record("com.example", 1L), calls::incrementAndGet);

        reply(new RemoveAck());
        clock.advance(TIMEOUT.multipliedBy(2));
        scheduler.runDueTasks();

        assertEquals(1, calls.get());
        assertTrue(sink.getTimeouts().isEmpty());
    }

    @Test
    void olderDeadlineDoesNotReleaseNewerRequest() {
        AtomicInteger calls = new AtomicInteger();

        bus.clearAll(() -> {});
        clock.advance(TIMEOUT.dividedBy(2));
        bus.clearAll(calls::incrementAndGet);

        clock.advance(TIMEOUT.dividedBy(2));
        scheduler.runDueTasks();
        assertTrue(bus.isPending(OperationKind.CLEAR_ALL));
        assertTrue(sink.getTimeouts().isEmpty());

        clock.advance(TIMEOUT.dividedBy(2));
        scheduler.runDueTasks();
        assertFalse(bus.isPending(OperationKind.CLEAR_ALL));
        assertEquals(1, sink.getTimeouts().size());
        assertEquals(0, calls.get());
    }

    @Test
    void activationListenerNeverExpires() {
        AtomicInteger calls = new AtomicInteger();
        bus.checkActivation(active -> calls.incrementAndGet());

        clock.advance(TIMEOUT.multipliedBy(10));
        scheduler.runDueTasks();
        reply(new ActivationReply(MessageBusConfig.DEFAULT_ACTIVATION_TOKEN));

        assertEquals(1, calls.get());
        assertTrue(sink.getTimeouts().isEmpty());
    }

    @Test
    void unregisterCancelsDeadlines() {
        bus.fetchList(records -> {});
        bus.clearAll(() -> {});
        assertEquals(2, scheduler.pendingTasks());

        assertTrue(bus.unregister(owner));

        assertEquals(0, scheduler.pendingTasks());
        clock.advance(TIMEOUT);
        scheduler.runDueTasks();
        assertTrue(sink.getTimeouts().isEmpty());
    }

    @Test
    void concurrentRequestsKeepTheNewestDeadline() throws Exception {
        CountDownLatch firstScheduling = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicBoolean holdNext = new AtomicBoolean(true);
        MonotonicScheduler gated = (deadlineNanos, task) -> {
            if (holdNext.compareAndSet(true, false)) {
                firstScheduling.countDown();
                await(releaseFirst);
            }
            return scheduler.scheduleAtNanos(deadlineNanos, task);
        };
        assertTrue(bus.unregister(owner));
        MessageBus gatedBus = newBus(gated);
        assertTrue(gatedBus.register(owner));

        Thread first = new Thread(() -> gatedBus.fetchList(records -> {}), "first-fetch");
        first.start();
        await(firstScheduling);

        // Armed after the first request but stores its deadline before it.
        gatedBus.fetchList(records -> {});
        releaseFirst.countDown();
        first.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(first.isAlive());

        clock.advance(TIMEOUT.multipliedBy(5));
        scheduler.runDueTasks();

        assertFalse(gatedBus.isPending(OperationKind.FETCH_LIST));
        assertEquals(1, sink.getTimeouts().size());
    }

    @Test
    void rejectedDeadlineReleasesRequestWithoutSendingIt() {
        MonotonicScheduler stopped = (deadlineNanos, task) -> {
            throw new RejectedExecutionException("deadline executor is shut down");
        };
        assertTrue(bus.unregister(owner));
        MessageBus stoppedBus = newBus(stopped);
        assertTrue(stoppedBus.register(owner));
        transport.clear();
        AtomicInteger calls = new AtomicInteger();

        assertDoesNotThrow(() -> stoppedBus.clearAll(calls::incrementAndGet));

        assertFalse(stoppedBus.isPending(OperationKind.CLEAR_ALL));
        assertTrue(transport.sent().isEmpty());
        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(RejectedExecutionException.class, sink.getErrors().get(0).cause());

        reply(new ClearAck());
        assertEquals(0, calls.get());
    }

    private MessageBus newBus(MonotonicScheduler deadlines) {
        MessageBusConfig config = MessageBusConfig.builder()
                .withReplyTimeout(TIMEOUT)
                .build();
        return new MessageBus(config, transport, new DefaultEnvelopeEncoder(), new DefaultEnvelopeDecoder(),
                sink, deadlines, clock);
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private void reply(BusMessage message) {
        transport.inject(LinkChannels.DEFAULT_REPLIES,
                new DefaultEnvelopeEncoder().encode(new BusMessageEncoder().encode(message)));
    }
}
