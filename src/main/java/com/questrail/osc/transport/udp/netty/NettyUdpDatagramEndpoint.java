package com.questrail.osc.transport.udp.netty;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.transport.DatagramEndpoint;
import com.questrail.osc.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class only moves datagrams. It does not decode OSC, dispatch, or
 * report protocol errors; {@code OscUdpTransportAdapter} does that.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]} and
 * reference-counted buffers are released internally.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds and returns once the bind has completed; the
 *       listener is told via {@code onTransportUp} or {@code onTransportDown}.</li>
 *   <li>{@link #stop()} closes the channel and shuts down the event loop group.</li>
 * </ul>
 *
 * <p>The receive buffer is sized to {@code maxDatagramSize} so that OSC
 * packets up to the configured maximum arrive unsplit.</p>
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;

    private final InetSocketAddress bindAddress;
    private final int maxDatagramSize;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, 65536);
    }

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxDatagramSize <= 0) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "maxDatagramSize must be > 0 (was " + maxDatagramSize + ")");
        }

        this.maxDatagramSize = maxDatagramSize;
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramSize))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (f.isSuccess()) {
            channel = f.channel();
            log.info("Netty OSC endpoint bound to {}", f.channel().localAddress());
            l.onTransportUp();
        }
        else {
            log.warn("Netty OSC endpoint failed to bind {}: {}", bindAddress, f.cause().getMessage());
            l.onTransportDown(f.cause());
        }
    }

    @Override
    public void stop()
    {
        DatagramEndpointListener l = listener;

        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).awaitUninterruptibly();

        if (ch != null && l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            log.debug("Dropping {} byte datagram to {}: endpoint not up", payload.length, remote);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    @Override
    public int maxDatagramSize()
    {
        return maxDatagramSize;
    }

    /**
     * The bound local address, available once {@link #start()} has succeeded.
     * Useful when binding to port 0.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each {@link DatagramPacket} into a {@code byte[]} for the listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
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
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Netty OSC endpoint failure: {}", cause.getMessage());
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
