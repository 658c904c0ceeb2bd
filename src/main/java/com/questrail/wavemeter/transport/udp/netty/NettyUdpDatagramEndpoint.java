package com.questrail.wavemeter.transport.udp.netty;

import com.questrail.wavemeter.transport.DatagramEndpoint;
import com.questrail.wavemeter.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty UDP socket behind the telemetry publisher.
 *
 * <h2>Traffic</h2>
 * Outbound: short text lines (heartbeat and one line per channel), sent many
 * times per second to every subscriber. Inbound: the occasional
 * {@code SUBSCRIBE} / {@code UNSUBSCRIBE} request. Inbound datagrams longer
 * than {@value #MAX_INBOUND_BYTES} bytes cannot be subscription requests and
 * are dropped here.
 *
 * <h2>Netty containment rule</h2>
 * {@code Channel}, {@code EventLoopGroup} and {@code ByteBuf} stay inside this
 * package. Payloads cross the port as {@code byte[]}.
 *
 * <h2>Broadcast</h2>
 * {@code SO_BROADCAST} is enabled so a subnet broadcast address can be
 * configured as a static subscriber.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    static final int MAX_INBOUND_BYTES = 256;

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup group;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean up = new AtomicBoolean(false);
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("wavemeter-telemetry-io", true));
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("listener must be set before start()");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new SubscriptionHandler());
                    }
                })
                .bind(bindAddress)
                .addListener((ChannelFutureListener) bound -> {
                    if (!bound.isSuccess()) {
                        log.error("Cannot bind telemetry socket to {}", bindAddress, bound.cause());
                        l.onTransportDown(bound.cause());
                        return;
                    }
                    channel = bound.channel();
                    up.set(true);
                    log.info("Telemetry socket bound to {}", channel.localAddress());
                    l.onTransportUp();
                });
    }

    @Override
    public void stop()
    {
        if (!started.compareAndSet(true, false)) {
            group.shutdownGracefully();
            return;
        }
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
        markDown();
        log.info("Telemetry socket closed ({} datagrams sent, {} dropped)", sent.get(), dropped.get());
    }

    /**
     * Drops the datagram (counted, not thrown) while the socket is not bound.
     *
     * @throws IllegalArgumentException if {@code remote} is not an {@link InetSocketAddress}
     */
    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (!(remote instanceof InetSocketAddress target)) {
            throw new IllegalArgumentException("UDP needs an InetSocketAddress (was " + remote + ")");
        }

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            dropped.incrementAndGet();
            return;
        }

        ch.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), target))
                .addListener((ChannelFutureListener) written -> {
                    if (written.isSuccess()) {
                        sent.incrementAndGet();
                    } else {
                        dropped.incrementAndGet();
                        log.debug("Telemetry datagram to {} dropped: {}", target, written.cause().toString());
                    }
                });
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.ofNullable((InetSocketAddress) ch.localAddress());
    }

    public long sentCount()
    {
        return sent.get();
    }

    public long droppedCount()
    {
        return dropped.get();
    }

    private void markDown()
    {
        DatagramEndpointListener l = listener;
        if (up.compareAndSet(true, false) && l != null) {
            l.onTransportDown(null);
        }
    }

    private final class SubscriptionHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            ByteBuf content = packet.content();
            if (l == null) {
                return;
            }
            if (content.readableBytes() > MAX_INBOUND_BYTES) {
                log.debug("Ignoring {}-byte datagram from {}", content.readableBytes(), packet.sender());
                return;
            }
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            markDown();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Per-datagram errors (ICMP port unreachable); the socket stays usable.
            log.debug("Telemetry socket error: {}", cause.toString());
        }
    }
}
