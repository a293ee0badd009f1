package com.phillippitts.granupose.service.osc.transport.netty;

import com.phillippitts.granupose.service.osc.transport.DatagramEndpoint;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointListener;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
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
import io.netty.util.concurrent.DefaultThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty-backed {@link DatagramEndpoint}.
 *
 * <p>Netty types do not leave this package: inbound payloads are copied into {@code byte[]}
 * before reaching the listener and reference-counted buffers are released here. Each endpoint
 * owns a single-threaded event loop, so listener callbacks are serialized on it.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint {

    private static final Logger LOG = LogManager.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, String threadName) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory(threadName, true));
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch) {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public CompletableFuture<InetSocketAddress> start() {
        if (stopped.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Endpoint already stopped"));
        }
        CompletableFuture<InetSocketAddress> bound = new CompletableFuture<>();
        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            DatagramEndpointListener l = listener;
            if (future.isSuccess()) {
                channel = future.channel();
                InetSocketAddress local = (InetSocketAddress) channel.localAddress();
                LOG.debug("UDP endpoint bound on {}", local);
                if (l != null) {
                    l.onTransportUp();
                }
                bound.complete(local);
            } else {
                LOG.warn("UDP bind on {} failed: {}", bindAddress, String.valueOf(future.cause()));
                if (l != null) {
                    l.onTransportDown(future.cause());
                }
                bound.completeExceptionally(future.cause());
            }
        });
        return bound;
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, 200, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<Void> send(InetSocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new IllegalStateException("UDP socket is not bound"));
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, remote)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(future.cause());
            }
        });
        return written;
    }

    @Override
    public boolean isBound() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    /**
     * Copies each inbound packet into a {@code byte[]} and forwards it to the listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            // UDP receive errors (e.g. ICMP port unreachable) do not invalidate the socket
            LOG.warn("UDP endpoint {} error: {}", bindAddress, cause.toString());
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
        }
    }
}
