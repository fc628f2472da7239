package com.questrail.sandnet.transport.netty;

import com.questrail.sandnet.errors.ConnectionClosedException;
import com.questrail.sandnet.errors.WouldBlockException;
import com.questrail.sandnet.transport.RawConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

/**
 * {@link RawConnection} over a Netty stream channel.
 *
 * <p>A write is refused with {@link WouldBlockException} while the channel's
 * outbound buffer is above its high-water mark; otherwise the whole payload is
 * queued and reported as sent. A queued write that later fails closes the
 * channel, so the next call reports {@link ConnectionClosedException}.</p>
 */
final class NettyConnection implements RawConnection
{
    private final Channel channel;
    private final InboundQueue inbound;

    NettyConnection(Channel channel, InboundQueue inbound)
    {
        this.channel = channel;
        this.inbound = inbound;
    }

    @Override
    public int send(byte[] data)
    {
        if (!channel.isActive()) {
            throw new ConnectionClosedException("connection to " + channel.remoteAddress() + " is closed");
        }
        if (!channel.isWritable()) {
            throw new WouldBlockException("outbound buffer full");
        }
        channel.writeAndFlush(Unpooled.copiedBuffer(data))
                .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        return data.length;
    }

    @Override
    public byte[] receive(int maxBytes)
    {
        return inbound.poll(maxBytes);
    }

    @Override
    public void close()
    {
        channel.close();
    }
}
