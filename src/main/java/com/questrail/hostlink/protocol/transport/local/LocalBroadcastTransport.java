package com.questrail.hostlink.protocol.transport.local;

import com.questrail.hostlink.protocol.transport.AbstractBroadcastTransport;

import java.util.Objects;

/**
 * One process's view of a {@link LocalBroadcastHub}. Unlike the UDP transport it
 * can be stopped and started again.
 */
public final class LocalBroadcastTransport extends AbstractBroadcastTransport
{
    private final LocalBroadcastHub hub;
    private volatile boolean started;

    LocalBroadcastTransport(LocalBroadcastHub hub)
    {
        this.hub = Objects.requireNonNull(hub, "hub");
    }

    @Override
    public void start()
    {
        if (started) {
            return;
        }
        started = true;
        hub.attach(this);
        notifyTransportUp();
    }

    @Override
    public void stop()
    {
        if (!started) {
            return;
        }
        started = false;
        hub.detach(this);
        notifyTransportDown(null);
    }

    @Override
    public void send(String channel, byte[] body)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(body, "body");

        if (!started) {
            return;
        }
        hub.broadcast(channel, body);
    }

    void receive(String channel, byte[] body)
    {
        if (started) {
            deliver(channel, body);
        }
    }

    public boolean isStarted()
    {
        return started;
    }
}
