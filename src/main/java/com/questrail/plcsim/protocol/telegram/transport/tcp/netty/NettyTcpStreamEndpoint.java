package com.questrail.plcsim.protocol.telegram.transport.tcp.netty;

import com.questrail.plcsim.protocol.telegram.transport.StreamEndpoint;
import com.questrail.plcsim.protocol.telegram.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelException;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not locate
 * telegram boundaries or decode anything.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into {@code byte[]}
 * and reference-counted buffers are released internally.
 *
 * <h2>Threading</h2>
 * Each endpoint owns a single-thread event loop. That thread is the
 * session's receive context: every {@link StreamEndpointListener} callback is
 * delivered on it. {@link #close()} waits for the event loop to terminate and
 * therefore must be called from another thread.
 *
 * <h2>Abortive shutdown</h2>
 * {@link #abort()} sets {@code SO_LINGER=0} before closing so the peer sees a
 * reset rather than an orderly FIN, and nothing lingers in the kernel.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 2_000;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile ChannelFuture pendingConnect;
    private volatile Channel channel;

    public NettyTcpStreamEndpoint()
    {
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("plcsim-rx", true));
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open(String host, int port, Duration timeout) throws IOException
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");
        requireListener();

        if (aborted.get() || closed.get()) {
            throw new IOException("endpoint already shut down");
        }

        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        ChannelFuture f = bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .connect(host, port);
        pendingConnect = f;

        // CONNECT_TIMEOUT_MILLIS fails the future on time; the extra margin only
        // guards against a stalled event loop.
        if (!f.awaitUninterruptibly(timeoutMillis + 500L)) {
            f.cancel(false);
            throw new IOException("connect to " + host + ":" + port + " timed out");
        }
        if (!f.isSuccess()) {
            throw asIOException("connect to " + host + ":" + port + " failed", f.cause());
        }

        channel = f.channel();
        if (aborted.get()) {
            // abort() raced with a successful connect.
            closeChannelAbortively(channel);
            throw new IOException("connect aborted");
        }
    }

    @Override
    public void write(byte[] payload, Duration timeout) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IOException("channel is not open");
        }

        ChannelFuture f = ch.writeAndFlush(Unpooled.wrappedBuffer(payload));
        if (!f.awaitUninterruptibly(timeout.toMillis())) {
            throw new IOException("write timed out after " + timeout.toMillis() + " ms");
        }
        if (!f.isSuccess()) {
            throw asIOException("write failed", f.cause());
        }
    }

    @Override
    public void abort()
    {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        ChannelFuture connecting = pendingConnect;
        if (connecting != null && !connecting.isDone()) {
            connecting.cancel(false);
        }
        Channel ch = channel;
        if (ch != null) {
            closeChannelAbortively(ch);
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        abort();

        Channel ch = channel;
        if (ch != null) {
            ch.closeFuture().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS);
        }
        if (!group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS + 500L)) {
            log.warn("Event loop did not terminate within {} ms", SHUTDOWN_TIMEOUT_MILLIS);
        }
    }

    private static void closeChannelAbortively(Channel ch)
    {
        try {
            ch.config().setOption(ChannelOption.SO_LINGER, 0);
        } catch (ChannelException e) {
            // Channel already gone; closing below is still correct.
            log.debug("Could not set SO_LINGER before close: {}", e.getMessage());
        }
        ch.close();
    }

    private static IOException asIOException(String message, Throwable cause)
    {
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException(message + (cause != null ? ": " + cause.getMessage() : ""), cause);
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before open()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each inbound {@link ByteBuf} into a {@code byte[]} and forwards it.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            l.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onInputClosed(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onInputClosed(cause);
            }
            ctx.close();
        }
    }
}
