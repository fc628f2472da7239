package com.questrail.sandnet.transport.netty;

import com.questrail.sandnet.errors.ConnectionClosedException;
import com.questrail.sandnet.errors.WouldBlockException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * InboundQueue
 * -----------------------------------------------------------------------------
 * Per-connection handler that turns Netty's push-style reads into a pull-style,
 * non-blocking queue.
 *
 * <p>Inbound {@link ByteBuf}s are copied into {@code byte[]} on the event loop
 * and released by {@link SimpleChannelInboundHandler}. Readers drain the
 * queue from any thread.</p>
 */
final class InboundQueue extends SimpleChannelInboundHandler<ByteBuf>
{
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private boolean ended;

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
    {
        byte[] bytes = new byte[msg.readableBytes()];
        msg.readBytes(bytes);
        synchronized (this) {
            chunks.addLast(bytes);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        synchronized (this) {
            ended = true;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        synchronized (this) {
            ended = true;
        }
        ctx.close();
    }

    /**
     * Take up to {@code maxBytes} in arrival order.
     *
     * @throws WouldBlockException       if nothing is queued and the channel is open
     * @throws ConnectionClosedException if nothing is queued and the channel has ended
     */
    synchronized byte[] poll(int maxBytes)
    {
        if (chunks.isEmpty()) {
            if (ended) {
                throw new ConnectionClosedException("connection closed by peer");
            }
            throw new WouldBlockException("no data available");
        }

        byte[] out = new byte[maxBytes];
        int filled = 0;
        while (filled < maxBytes && !chunks.isEmpty()) {
            byte[] head = chunks.pollFirst();
            int take = Math.min(head.length, maxBytes - filled);
            System.arraycopy(head, 0, out, filled, take);
            filled += take;
            if (take < head.length) {
                chunks.addFirst(Arrays.copyOfRange(head, take, head.length));
            }
        }
        return filled == maxBytes ? out : Arrays.copyOf(out, filled);
    }
}
