package com.questrail.hostlink.protocol.transport;

/**
 * BroadcastListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link BroadcastTransport} subscription.
 *
 * <p>Callbacks for one transport are delivered serially on the transport's
 * dispatch context (the Netty event loop, or the hub's dispatch executor). No
 * two broadcasts are handed to the same listener concurrently.</p>
 */
public interface BroadcastListener
{
    /**
     * Called for every broadcast on the channel this listener subscribed to.
     *
     * <p>The body is the complete envelope body, owned by the listener.</p>
     *
     * @param channel channel name the broadcast was addressed to
     * @param body    raw envelope body
     */
    void onBroadcast(String channel, byte[] body);

    /**
     * Transport became usable. Lifecycle signal only.
     */
    default void onTransportUp() {
    }

    /**
     * Transport became unusable.
     *
     * @param cause diagnostic cause, or {@code null} for an orderly stop
     */
    default void onTransportDown(Throwable cause) {
    }
}
