package com.questrail.hostlink.protocol.transport;

/**
 * BroadcastTransport
 * -----------------------------------------------------------------------------
 * Port for an unordered, at-most-once, device-local broadcast primitive.
 *
 * <p>A broadcast is addressed to a channel name. Every subscriber of that
 * channel on every process attached to the same medium may receive it; nothing
 * is acknowledged and nothing is retried. Sending on a transport that is not
 * started drops the broadcast.</p>
 *
 * <p>Implementations may be backed by Netty UDP, an in-process hub, or a test
 * double.</p>
 */
public interface BroadcastTransport
{
    /**
     * Begin sending and receiving. Subscribers are told via
     * {@link BroadcastListener#onTransportUp()}.
     */
    void start();

    /**
     * Release transport resources. Subscribers are told via
     * {@link BroadcastListener#onTransportDown(Throwable)}.
     */
    void stop();

    /**
     * Fire-and-forget send. Returns without waiting for delivery.
     *
     * @param channel channel name the receivers filter on
     * @param body    envelope body
     */
    void send(String channel, byte[] body);

    /**
     * Deliver broadcasts on {@code channel} to {@code listener}.
     *
     * @throws IllegalStateException if {@code listener} is already subscribed
     */
    void subscribe(String channel, BroadcastListener listener);

    /**
     * Stop delivering to {@code listener}.
     *
     * @throws IllegalArgumentException if {@code listener} is not subscribed
     */
    void unsubscribe(BroadcastListener listener);
}
