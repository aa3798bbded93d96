package com.questrail.hostlink.protocol.transport.udp.netty;

import com.questrail.hostlink.protocol.transport.AbstractBroadcastTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpBroadcastTransport
 * =============================================================================
 * Netty-backed {@link com.questrail.hostlink.protocol.transport.BroadcastTransport}
 * over UDP broadcast.
 *
 * <h2>Datagram layout</h2>
 * <pre>
 *   u16 length + UTF-8   channel name
 *   remaining bytes      envelope body (opaque to this class)
 * </pre>
 *
 * <p>Every process on the link binds the same port with {@code SO_REUSEADDR}
 * and sends to the shared broadcast address, so a process also hears its own
 * broadcasts. Channel filtering in the subscription table keeps requests and
 * replies apart.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound bodies are copied into {@code byte[]}.
 *
 * <h2>Dispatch context</h2>
 * One event-loop thread serves the channel, so inbound deliveries are serial.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds asynchronously; {@link #stop()} closes the channel and
 * shuts down the event loop. A stopped transport cannot be restarted.
 */
public final class NettyUdpBroadcastTransport extends AbstractBroadcastTransport
{
    private static final int MAX_CHANNEL_NAME_BYTES = 0xFFFF;

    private final InetSocketAddress bindAddress;
    private final InetSocketAddress broadcastAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Channel channel;

    /**
     * @param bindAddress      local address to receive on
     * @param broadcastAddress destination of every send
     */
    public NettyUdpBroadcastTransport(InetSocketAddress bindAddress, InetSocketAddress broadcastAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.broadcastAddress = Objects.requireNonNull(broadcastAddress, "broadcastAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void start()
    {
        if (stopped.get()) {
            throw new IllegalStateException("Transport already stopped");
        }

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                notifyTransportUp();
            }
            else {
                notifyTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();

        notifyTransportDown(null);
    }

    @Override
    public void send(String channelName, byte[] body)
    {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(body, "body");

        byte[] name = channelName.getBytes(StandardCharsets.UTF_8);
        if (name.length > MAX_CHANNEL_NAME_BYTES) {
            throw new IllegalArgumentException("Channel name too long: " + name.length + " bytes");
        }

        Channel ch = channel;
        if (ch == null) {
            // Not bound yet, or already stopped. Fire-and-forget: drop.
            return;
        }

        ByteBuf buf = ch.alloc().buffer(2 + name.length + body.length);
        buf.writeShort(name.length);
        buf.writeBytes(name);
        buf.writeBytes(body);
        ch.writeAndFlush(new DatagramPacket(buf, broadcastAddress));
    }

    /**
     * @return the bound local address once the transport is up
     */
    public Optional<SocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Splits each datagram into channel name and body and hands it to the
     * subscription table. Datagrams too short for their own length prefix are
     * dropped.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            ByteBuf content = packet.content();
            if (content.readableBytes() < 2) {
                return;
            }
            int nameLength = content.readUnsignedShort();
            if (content.readableBytes() < nameLength) {
                return;
            }

            String channelName = content.readCharSequence(nameLength, StandardCharsets.UTF_8).toString();
            byte[] body = new byte[content.readableBytes()];
            content.readBytes(body);

            deliver(channelName, body);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyTransportDown(cause);
            ctx.close();
        }
    }
}
