package com.questrail.sandnet.transport.netty;

import com.questrail.sandnet.errors.TransportException;
import com.questrail.sandnet.errors.WouldBlockException;
import com.questrail.sandnet.transport.RawMessageEndpoint;
import com.questrail.sandnet.transport.ReceivedMessage;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * {@link RawMessageEndpoint} over a bound Netty datagram channel.
 */
final class NettyMessageEndpoint implements RawMessageEndpoint
{
    private final Queue<ReceivedMessage> pending = new ConcurrentLinkedQueue<>();
    private volatile Channel channel;

    void bound(Channel channel)
    {
        this.channel = channel;
    }

    SimpleChannelInboundHandler<DatagramPacket> handler()
    {
        return new SimpleChannelInboundHandler<>() {
            @Override
            protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
            {
                // Copy the payload out; the packet is released on return.
                ByteBuf content = packet.content();
                byte[] bytes = new byte[content.readableBytes()];
                content.getBytes(content.readerIndex(), bytes);
                pending.add(new ReceivedMessage(NettyRawTransport.endpointOf(packet.sender()), bytes));
            }
        };
    }

    @Override
    public ReceivedMessage receive()
    {
        ReceivedMessage next = pending.poll();
        if (next != null) {
            return next;
        }
        Channel ch = channel;
        if (ch == null || !ch.isOpen()) {
            throw new TransportException("datagram channel is closed");
        }
        throw new WouldBlockException("no pending datagram");
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }
}
