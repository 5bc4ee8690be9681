package com.questrail.touchportal.transport.netty;

import com.questrail.touchportal.transport.StreamEndpoint;
import com.questrail.touchportal.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Split lines or decode JSON</li>
 *   <li>Interpret controller messages</li>
 *   <li>Reconnect</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #open()} connects and blocks until the socket is established.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 *
 * <p>Writes are refused while more than {@link #WRITE_HIGH_WATER_MARK} bytes
 * are waiting to be flushed, so a peer that stops reading cannot grow the
 * outbound buffer without bound.</p>
 *
 * <p>Each {@code open()} uses its own single-threaded {@link NioEventLoopGroup},
 * so a closed endpoint can be opened again.</p>
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    /** Outbound bytes queued in Netty beyond which writes are refused. */
    static final int WRITE_HIGH_WATER_MARK = 64 * 1024;
    static final int WRITE_LOW_WATER_MARK = 32 * 1024;

    private final String host;
    private final int port;
    private final Duration connectTimeout;

    private volatile StreamEndpointListener listener;
    private volatile Session session;

    public NettyTcpStreamEndpoint(String host, int port, Duration connectTimeout)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void open() throws IOException
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before open()");
        }
        if (session != null) {
            throw new IllegalStateException("Endpoint is already open");
        }

        EventLoopGroup group = new NioEventLoopGroup(1);
        Session s = new Session(group, l);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .option(ChannelOption.WRITE_BUFFER_WATER_MARK,
                        new WriteBufferWaterMark(WRITE_LOW_WATER_MARK, WRITE_HIGH_WATER_MARK))
                .handler(new ChannelInitializer<NioSocketChannel>() {
                    @Override
                    protected void initChannel(NioSocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler(s));
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        try {
            f.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            group.shutdownGracefully();
            throw new InterruptedIOException("Interrupted while connecting to " + host + ":" + port);
        }
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            throw new IOException("Cannot connect to " + host + ":" + port, f.cause());
        }

        s.channel = f.channel();
        session = s;
        log.debug("Connected to {}:{}", host, port);
    }

    @Override
    public boolean write(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Session s = session;
        if (s == null || !s.channel.isActive()) {
            return false;
        }
        if (!s.channel.isWritable()) {
            log.warn("Outbound buffer above {} bytes, dropping {} byte write", WRITE_HIGH_WATER_MARK, payload.length);
            return false;
        }
        s.channel.writeAndFlush(Unpooled.wrappedBuffer(payload));
        return true;
    }

    @Override
    public synchronized void close()
    {
        Session s = session;
        if (s == null) {
            return;
        }
        session = null;

        s.channel.close();
        s.group.shutdownGracefully();
        s.notifyClosed(null);
    }

    /**
     * Per-connection resources. Guarantees a single closed notification.
     */
    private static final class Session
    {
        private final EventLoopGroup group;
        private final StreamEndpointListener listener;
        private final AtomicBoolean closedNotified = new AtomicBoolean();
        private volatile Channel channel;

        Session(EventLoopGroup group, StreamEndpointListener listener)
        {
            this.group = group;
            this.listener = listener;
        }

        void notifyClosed(Throwable cause)
        {
            if (closedNotified.compareAndSet(false, true)) {
                listener.onClosed(cause);
            }
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link ByteBuf}s and forwards raw bytes to the port listener.
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final Session session;

        InboundHandler(Session session)
        {
            this.session = session;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            // Copy the payload into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            session.listener.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            session.notifyClosed(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Stream failed", cause);
            session.notifyClosed(cause);
            ctx.close();
        }
    }
}
