package com.questrail.sandnet.transport.netty;

import com.questrail.sandnet.api.Endpoint;
import com.questrail.sandnet.errors.AlreadyInUseException;
import com.questrail.sandnet.errors.OperationTimeoutException;
import com.questrail.sandnet.errors.SandnetException;
import com.questrail.sandnet.errors.TransportException;
import com.questrail.sandnet.transport.AcceptedConnection;
import com.questrail.sandnet.transport.RawConnection;
import com.questrail.sandnet.transport.RawListener;
import com.questrail.sandnet.transport.RawMessageEndpoint;
import com.questrail.sandnet.transport.RawTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyRawTransport
 * =============================================================================
 * Netty-backed implementation of the {@link RawTransport} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it binds, connects and moves
 * bytes. It does not retry, rotate ports, or wait for data.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g. {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes, datagrams and accepted child
 * channels are copied into queues on the event loop and drained
 * non-blockingly by the callers of the port.
 *
 * <h2>Error mapping</h2>
 * <ul>
 *   <li>{@link BindException} → {@link AlreadyInUseException}</li>
 *   <li>{@link ConnectTimeoutException} → {@link OperationTimeoutException}</li>
 *   <li>anything else → {@link TransportException}</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * The transport owns one {@link NioEventLoopGroup}; {@link #close()} shuts it
 * down, which closes every channel it created.
 */
public final class NettyRawTransport implements RawTransport, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyRawTransport.class);

    private final EventLoopGroup group;

    public NettyRawTransport()
    {
        this(new NioEventLoopGroup(2));
    }

    NettyRawTransport(EventLoopGroup group)
    {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public RawConnection connect(String remoteAddress, int remotePort,
                                 String localAddress, int localPort,
                                 Duration timeout)
    {
        InboundQueue inbound = new InboundQueue();
        int connectMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .handler(inbound);

        ChannelFuture f = bootstrap.connect(
                new InetSocketAddress(remoteAddress, remotePort),
                new InetSocketAddress(localAddress, localPort));
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw translate(f.cause(), "connect " + localAddress + ":" + localPort
                    + " -> " + remoteAddress + ":" + remotePort);
        }
        return new NettyConnection(f.channel(), inbound);
    }

    @Override
    public RawListener listen(String localAddress, int localPort)
    {
        NettyListener listener = new NettyListener();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        InboundQueue inbound = new InboundQueue();
                        ch.pipeline().addLast(inbound);
                        listener.enqueue(new AcceptedConnection(
                                endpointOf(ch.remoteAddress()),
                                new NettyConnection(ch, inbound)));
                    }
                });

        ChannelFuture f = bootstrap.bind(new InetSocketAddress(localAddress, localPort));
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw translate(f.cause(), "listen on " + localAddress + ":" + localPort);
        }
        listener.bound(f.channel());
        return listener;
    }

    @Override
    public RawMessageEndpoint listenForMessages(String localAddress, int localPort)
    {
        NettyMessageEndpoint endpoint = new NettyMessageEndpoint();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(endpoint.handler());

        ChannelFuture f = bootstrap.bind(new InetSocketAddress(localAddress, localPort));
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw translate(f.cause(), "bind UDP " + localAddress + ":" + localPort);
        }
        endpoint.bound(f.channel());
        return endpoint;
    }

    @Override
    public int sendMessage(String remoteAddress, int remotePort, byte[] payload,
                           String localAddress, int localPort)
    {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(new ChannelInboundHandlerAdapter());

        ChannelFuture bind = bootstrap.bind(new InetSocketAddress(localAddress, localPort));
        bind.awaitUninterruptibly();
        if (!bind.isSuccess()) {
            throw translate(bind.cause(), "bind UDP " + localAddress + ":" + localPort);
        }

        Channel ch = bind.channel();
        try {
            DatagramPacket packet = new DatagramPacket(
                    Unpooled.copiedBuffer(payload),
                    new InetSocketAddress(remoteAddress, remotePort));
            ChannelFuture write = ch.writeAndFlush(packet).awaitUninterruptibly();
            if (!write.isSuccess()) {
                throw translate(write.cause(), "send UDP to " + remoteAddress + ":" + remotePort);
            }
            return payload.length;
        } finally {
            ch.close();
        }
    }

    /**
     * Shut down the event loop group and every channel on it.
     */
    @Override
    public void close()
    {
        if (!group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS)) {
            log.warn("Netty event loop group did not terminate within 5s");
        }
    }

    static Endpoint endpointOf(SocketAddress address)
    {
        InetSocketAddress inet = (InetSocketAddress) address;
        return Endpoint.of(inet.getAddress().getHostAddress(), inet.getPort());
    }

    private static SandnetException translate(Throwable cause, String what)
    {
        if (cause instanceof BindException) {
            return new AlreadyInUseException(what + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof ConnectTimeoutException) {
            return new OperationTimeoutException(what + ": " + cause.getMessage(), cause);
        }
        return new TransportException(what + " failed", cause);
    }
}
