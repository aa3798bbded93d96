package com.questrail.hostlink.protocol.transport.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * LocalBroadcastHub
 * =============================================================================
 * In-process broadcast medium.
 *
 * <p>Every {@link LocalBroadcastTransport} created by a hub shares one medium: a
 * send on any of them is offered to all started transports of the hub, the
 * sender included, each of which filters by channel. Delivery runs on the
 * hub's dispatch executor, asynchronously to the sender.</p>
 *
 * <p>The default dispatch executor is a single daemon thread, which gives the
 * serial per-receiver delivery the bus expects. Tests may pass a direct
 * executor ({@code Runnable::run}) to make delivery synchronous.</p>
 *
 * <p>Once the hub is closed, sends are dropped like any other undeliverable
 * broadcast.</p>
 */
public final class LocalBroadcastHub implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(LocalBroadcastHub.class);

    private final Executor dispatcher;
    private final ExecutorService ownedDispatcher;
    private final List<LocalBroadcastTransport> attached = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public LocalBroadcastHub()
    {
        this.ownedDispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hostlink-local-broadcast");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = ownedDispatcher;
    }

    /**
     * @param dispatcher executor all deliveries run on; not shut down by {@link #close()}
     */
    public LocalBroadcastHub(Executor dispatcher)
    {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ownedDispatcher = null;
    }

    /**
     * Create a transport attached to this hub. It receives nothing until started.
     */
    public LocalBroadcastTransport newTransport()
    {
        return new LocalBroadcastTransport(this);
    }

    void attach(LocalBroadcastTransport transport)
    {
        if (!attached.contains(transport)) {
            attached.add(transport);
        }
    }

    void detach(LocalBroadcastTransport transport)
    {
        attached.remove(transport);
    }

    void broadcast(String channel, byte[] body)
    {
        if (closed) {
            // Fire-and-forget: nobody is listening any more.
            return;
        }
        final byte[] copy = body.clone();
        try {
            dispatcher.execute(() -> {
                for (LocalBroadcastTransport transport : attached) {
                    transport.receive(channel, copy);
                }
            });
        }
        catch (RejectedExecutionException e) {
            log.debug("Dispatcher rejected broadcast on channel {}; dropped", channel, e);
        }
    }

    /**
     * Drop every later send and shut down the dispatch thread if this hub
     * created it.
     */
    @Override
    public void close()
    {
        closed = true;
        attached.clear();
        if (ownedDispatcher != null) {
            ownedDispatcher.shutdown();
        }
    }
}
