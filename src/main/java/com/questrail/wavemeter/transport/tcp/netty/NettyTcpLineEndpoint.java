package com.questrail.wavemeter.transport.tcp.netty;

import com.questrail.wavemeter.transport.ReplyChannel;
import com.questrail.wavemeter.transport.RequestReplyEndpoint;
import com.questrail.wavemeter.transport.RequestReplyListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyTcpLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link RequestReplyEndpoint} port:
 * newline-delimited UTF-8 requests and replies over TCP.
 *
 * <h2>Framing</h2>
 * One JSON command per line; one JSON reply per line, written on the
 * connection the command arrived on. A line longer than
 * {@value #MAX_LINE_LENGTH} bytes closes that connection. Command decoding
 * and execution happen in the listener, off the event loop.
 *
 * <h2>Netty containment rule</h2>
 * Netty types stay in this package. Replies go through a {@link ReplyChannel}
 * closure that captures the connection.
 *
 * <h2>Lifecycle</h2>
 * {@link #stop()} closes every client connection and the server socket, then
 * shuts down both event loop groups.
 */
public final class NettyTcpLineEndpoint implements RequestReplyEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineEndpoint.class);

    /**
     * Longest accepted request line, in bytes.
     */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile RequestReplyListener listener;
    private volatile Channel serverChannel;

    public NettyTcpLineEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("wavemeter-command-accept", true));
        this.workerGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("wavemeter-command-io", true));
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new RequestHandler());
                    }
                });
    }

    @Override
    public void setListener(RequestReplyListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        RequestReplyListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
                log.info("Command TCP endpoint listening on {}", serverChannel.localAddress());
                l.onTransportUp();
            }
            else {
                log.error("Command TCP endpoint failed to bind {}", bindAddress, future.cause());
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel server = serverChannel;
        if (server != null) {
            server.close().syncUninterruptibly();
        }
        clients.close().syncUninterruptibly();

        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();

        RequestReplyListener l = listener;
        if (server != null && l != null) {
            l.onTransportDown(null);
        }
        serverChannel = null;
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel server = serverChannel;
        if (server == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((InetSocketAddress) server.localAddress());
    }

    private RequestReplyListener requireListener()
    {
        RequestReplyListener l = listener;
        if (l == null) {
            throw new IllegalStateException("RequestReplyListener must be set before start()");
        }
        return l;
    }

    /**
     * RequestHandler
     * -------------------------------------------------------------------------
     * Delivers decoded lines to the port listener with a reply closure bound to
     * the connection.
     */
    private final class RequestHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            clients.add(ctx.channel());
            log.debug("Command client connected: {}", ctx.channel().remoteAddress());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            RequestReplyListener l = listener;
            if (l == null) {
                return;
            }
            Channel ch = ctx.channel();
            SocketAddress remote = ch.remoteAddress();
            ReplyChannel reply = text -> {
                if (ch.isActive()) {
                    ch.writeAndFlush(text + "\n");
                } else {
                    log.debug("Reply to {} dropped: connection closed", remote);
                }
            };
            l.onRequest(remote, line, reply);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            log.debug("Command client disconnected: {}", ctx.channel().remoteAddress());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Command connection {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
        }
    }
}
