package com.questrail.hostlink.protocol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Subscription bookkeeping shared by the concrete transports.
 *
 * <p>Subclasses perform I/O and call {@link #deliver}, {@link #notifyTransportUp}
 * and {@link #notifyTransportDown} from their dispatch context.</p>
 */
public abstract class AbstractBroadcastTransport implements BroadcastTransport
{
    private static final Logger log = LoggerFactory.getLogger(AbstractBroadcastTransport.class);

    private final Map<BroadcastListener, String> subscriptions = new ConcurrentHashMap<>();

    @Override
    public void subscribe(String channel, BroadcastListener listener)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(listener, "listener");

        if (subscriptions.putIfAbsent(listener, channel) != null) {
            throw new IllegalStateException("Listener already subscribed: " + listener);
        }
    }

    @Override
    public void unsubscribe(BroadcastListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        if (subscriptions.remove(listener) == null) {
            throw new IllegalArgumentException("Listener not subscribed: " + listener);
        }
    }

    public boolean isSubscribed(BroadcastListener listener)
    {
        return subscriptions.containsKey(listener);
    }

    /**
     * Hand {@code body} to every listener subscribed to {@code channel}.
     * A listener that throws does not prevent delivery to the others.
     */
    protected final void deliver(String channel, byte[] body)
    {
        for (Map.Entry<BroadcastListener, String> e : subscriptions.entrySet()) {
            if (!e.getValue().equals(channel)) {
                continue;
            }
            try {
                e.getKey().onBroadcast(channel, body.clone());
            }
            catch (RuntimeException ex) {
                log.warn("Broadcast listener {} failed on channel {}", e.getKey(), channel, ex);
            }
        }
    }

    protected final void notifyTransportUp()
    {
        for (BroadcastListener listener : subscriptions.keySet()) {
            try {
                listener.onTransportUp();
            }
            catch (RuntimeException ex) {
                log.warn("Broadcast listener {} failed on transport up", listener, ex);
            }
        }
    }

    protected final void notifyTransportDown(Throwable cause)
    {
        for (BroadcastListener listener : subscriptions.keySet()) {
            try {
                listener.onTransportDown(cause);
            }
            catch (RuntimeException ex) {
                log.warn("Broadcast listener {} failed on transport down", listener, ex);
            }
        }
    }
}
